/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class FunctionDeclaration extends Declaration {
    private final FunctionExpression function;

    public FunctionDeclaration(final SimpleIdentifier name, final FunctionExpression function,
                               final SourceSpan span) {
        super(name, span);
        this.function = function;
    }

    public FunctionExpression getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return "FunctionDeclaration{" +
                "name=" + getName() +
                ", function=" + function +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitFunctionDeclaration(this, context);
    }
}
