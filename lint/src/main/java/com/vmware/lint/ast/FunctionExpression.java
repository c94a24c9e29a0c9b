/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * A function literal. Also the part of a top-level function declaration that holds its parameters and body.
 */
public class FunctionExpression extends Expression implements FunctionLike {
    private final FormalParameterList parameters;
    private final FunctionBody body;

    public FunctionExpression(final FormalParameterList parameters, final FunctionBody body,
                              final SourceSpan span) {
        super(span);
        this.parameters = parameters;
        this.body = Preconditions.checkNotNull(body, "A function literal always has a body");
    }

    @Override
    public FormalParameterList getParameters() {
        return parameters;
    }

    @Override
    public Optional<FunctionBody> getBody() {
        return Optional.of(body);
    }

    @Override
    public String toString() {
        return "FunctionExpression{" +
                "parameters=" + parameters +
                ", body=" + body +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitFunctionExpression(this, context);
    }
}
