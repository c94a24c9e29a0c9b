/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public class SimpleAstVisitor extends AstVisitor<VoidType, VoidType> {

    public VoidType visit(final AstNode node) {
        return visit(node, defaultReturn());
    }

    @Override
    protected final VoidType defaultReturn() {
        return VoidType.NONE;
    }
}
