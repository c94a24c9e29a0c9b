/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class BinaryExpression extends Expression {
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(final Expression left, final Operator operator, final Expression right,
                            final SourceSpan span) {
        super(span);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return left + " " + operator.getLexeme() + " " + right;
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitBinaryExpression(this, context);
    }

    public enum Operator {
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        GREATER_THAN(">"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN_OR_EQUAL(">="),
        AND("&&"),
        OR("||"),
        IF_NULL("??"),
        PLUS("+"),
        MINUS("-"),
        TIMES("*"),
        DIVIDE("/");

        private final String lexeme;

        Operator(final String lexeme) {
            this.lexeme = lexeme;
        }

        public String getLexeme() {
            return lexeme;
        }
    }
}
