/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A local variable such as {@code var a = 1;}. A local may share its name with a parameter of the enclosing
 * function.
 */
public class VariableDeclarationStatement extends Statement {
    private final SimpleIdentifier name;
    @Nullable private final Expression initializer;

    public VariableDeclarationStatement(final SimpleIdentifier name, @Nullable final Expression initializer,
                                        final SourceSpan span) {
        super(span);
        this.name = name;
        this.initializer = initializer;
    }

    public SimpleIdentifier getName() {
        return name;
    }

    public Optional<Expression> getInitializer() {
        return Optional.ofNullable(initializer);
    }

    @Override
    public String toString() {
        return "var " + name + (initializer == null ? "" : " = " + initializer) + ";";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitVariableDeclarationStatement(this, context);
    }
}
