/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class ClassDeclaration extends Declaration {
    private final List<Declaration> members;

    public ClassDeclaration(final SimpleIdentifier name, final List<Declaration> members, final SourceSpan span) {
        super(name, span);
        this.members = ImmutableList.copyOf(members);
    }

    public List<Declaration> getMembers() {
        return members;
    }

    @Override
    public String toString() {
        return "ClassDeclaration{" +
                "name=" + getName() +
                ", members=" + members +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitClassDeclaration(this, context);
    }
}
