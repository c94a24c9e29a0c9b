/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

public abstract class AstNode {
    private final SourceSpan span;

    AstNode(final SourceSpan span) {
        this.span = Preconditions.checkNotNull(span);
    }

    public SourceSpan getSpan() {
        return span;
    }

    public int getOffset() {
        return span.getOffset();
    }

    @Nullable
    abstract <T, C> T acceptVisitor(AstVisitor<T, C> visitor, @Nullable C context);
}
