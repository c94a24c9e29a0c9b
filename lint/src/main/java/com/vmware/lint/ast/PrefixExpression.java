/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class PrefixExpression extends Expression {
    private final Operator operator;
    private final Expression operand;

    public PrefixExpression(final Operator operator, final Expression operand, final SourceSpan span) {
        super(span);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return operator.getLexeme() + operand;
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitPrefixExpression(this, context);
    }

    public enum Operator {
        NOT("!"),
        NEGATE("-");

        private final String lexeme;

        Operator(final String lexeme) {
            this.lexeme = lexeme;
        }

        public String getLexeme() {
            return lexeme;
        }
    }
}
