/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.base.Preconditions;

public class SimpleIdentifier extends Expression {
    private final String name;

    public SimpleIdentifier(final String name, final SourceSpan span) {
        super(span);
        Preconditions.checkArgument(!name.isEmpty(), "Empty identifier");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitSimpleIdentifier(this, context);
    }
}
