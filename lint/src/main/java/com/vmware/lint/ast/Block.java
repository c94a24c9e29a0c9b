/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class Block extends Statement {
    private final List<Statement> statements;

    public Block(final List<Statement> statements, final SourceSpan span) {
        super(span);
        this.statements = ImmutableList.copyOf(statements);
    }

    /**
     * @return statements in the order they appear in the source
     */
    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return "Block{" +
                "statements=" + statements +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitBlock(this, context);
    }
}
