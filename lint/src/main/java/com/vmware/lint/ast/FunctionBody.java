/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public abstract class FunctionBody extends AstNode {

    FunctionBody(final SourceSpan span) {
        super(span);
    }
}
