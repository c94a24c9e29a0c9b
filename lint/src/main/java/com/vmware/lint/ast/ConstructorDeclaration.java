/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A constructor of a class. Constructors declared {@code external} have no body.
 */
public class ConstructorDeclaration extends Declaration implements FunctionLike {
    private final FormalParameterList parameters;
    @Nullable private final FunctionBody body;

    public ConstructorDeclaration(final SimpleIdentifier name, final FormalParameterList parameters,
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
        return "ConstructorDeclaration{" +
                "name=" + getName() +
                ", parameters=" + parameters +
                ", body=" + body +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitConstructorDeclaration(this, context);
    }
}
