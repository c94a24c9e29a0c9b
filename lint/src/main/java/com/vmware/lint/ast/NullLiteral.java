/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class NullLiteral extends Expression {

    public NullLiteral(final SourceSpan span) {
        super(span);
    }

    @Override
    public String toString() {
        return "null";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitNullLiteral(this, context);
    }
}
