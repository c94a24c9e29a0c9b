/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * An instance or static method. Abstract methods have an {@link EmptyFunctionBody}, external ones have no body.
 */
public class MethodDeclaration extends Declaration implements FunctionLike {
    private final FormalParameterList parameters;
    @Nullable private final FunctionBody body;

    public MethodDeclaration(final SimpleIdentifier name, final FormalParameterList parameters,
                             @Nullable final FunctionBody body, final SourceSpan span) {
        super(name, span);
        this.parameters = parameters;
        this.body = body;
    }

    @Override
    public FormalParameterList getParameters() {
        return parameters;
    }

    @Override
    public Optional<FunctionBody> getBody() {
        return Optional.ofNullable(body);
    }

    @Override
    public String toString() {
        return "MethodDeclaration{" +
                "name=" + getName() +
                ", parameters=" + parameters +
                ", body=" + body +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitMethodDeclaration(this, context);
    }
}
