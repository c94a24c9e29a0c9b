/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public abstract class Declaration extends AstNode {
    private final SimpleIdentifier name;

    Declaration(final SimpleIdentifier name, final SourceSpan span) {
        super(span);
        this.name = name;
    }

    public SimpleIdentifier getName() {
        return name;
    }
}
