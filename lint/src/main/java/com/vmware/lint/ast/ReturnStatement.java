/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

public class ReturnStatement extends Statement {
    @Nullable private final Expression expression;

    public ReturnStatement(@Nullable final Expression expression, final SourceSpan span) {
        super(span);
        this.expression = expression;
    }

    public Optional<Expression> getExpression() {
        return Optional.ofNullable(expression);
    }

    @Override
    public String toString() {
        return expression == null ? "return;" : "return " + expression + ";";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitReturnStatement(this, context);
    }
}
