/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class FormalParameterList extends AstNode {
    private final List<FormalParameter> parameters;

    public FormalParameterList(final List<FormalParameter> parameters, final SourceSpan span) {
        super(span);
        this.parameters = ImmutableList.copyOf(parameters);
    }

    /**
     * @return parameters in declaration order, positional and named alike
     */
    public List<FormalParameter> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "FormalParameterList{" +
                "parameters=" + parameters +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitFormalParameterList(this, context);
    }
}
