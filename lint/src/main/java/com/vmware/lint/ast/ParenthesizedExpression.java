/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class ParenthesizedExpression extends Expression {
    private final Expression expression;

    public ParenthesizedExpression(final Expression expression, final SourceSpan span) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public Expression unParenthesized() {
        return expression.unParenthesized();
    }

    @Override
    public String toString() {
        return "(" + expression + ")";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitParenthesizedExpression(this, context);
    }
}
