/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

/**
 * The {@code ;} body of an abstract or redirecting declaration.
 */
public class EmptyFunctionBody extends FunctionBody {

    public EmptyFunctionBody(final SourceSpan span) {
        super(span);
    }

    @Override
    public String toString() {
        return ";";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitEmptyFunctionBody(this, context);
    }
}
