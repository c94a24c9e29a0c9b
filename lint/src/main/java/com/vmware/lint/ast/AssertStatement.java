/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * {@code assert(condition)} or {@code assert(condition, message)}.
 */
public class AssertStatement extends Statement {
    private final Expression condition;
    @Nullable private final Expression message;

    public AssertStatement(final Expression condition, @Nullable final Expression message, final SourceSpan span) {
        super(span);
        this.condition = condition;
        this.message = message;
    }

    public Expression getCondition() {
        return condition;
    }

    public Optional<Expression> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "assert(" + condition + (message == null ? "" : ", " + message) + ");";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitAssertStatement(this, context);
    }
}
