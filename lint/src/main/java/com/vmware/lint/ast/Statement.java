/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public abstract class Statement extends AstNode {

    Statement(final SourceSpan span) {
        super(span);
    }
}
