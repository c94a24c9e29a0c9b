/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

/**
 * A body written as a block of statements: {@code { ... }}.
 */
public class BlockFunctionBody extends FunctionBody {
    private final Block block;

    public BlockFunctionBody(final Block block, final SourceSpan span) {
        super(span);
        this.block = block;
    }

    public Block getBlock() {
        return block;
    }

    @Override
    public String toString() {
        return "BlockFunctionBody{" +
                "block=" + block +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitBlockFunctionBody(this, context);
    }
}
