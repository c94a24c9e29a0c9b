/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

/**
 * A body written as a single expression: {@code => expression;}.
 */
public class ExpressionFunctionBody extends FunctionBody {
    private final Expression expression;

    public ExpressionFunctionBody(final Expression expression, final SourceSpan span) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "=> " + expression + ";";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitExpressionFunctionBody(this, context);
    }
}
