/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public abstract class Expression extends AstNode {

    Expression(final SourceSpan span) {
        super(span);
    }

    /**
     * @return the innermost expression once every enclosing pair of parentheses has been removed
     */
    public Expression unParenthesized() {
        return this;
    }
}
