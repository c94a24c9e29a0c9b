/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

public class FormalParameter extends AstNode {
    private final SimpleIdentifier identifier;
    private final ParameterKind kind;
    @Nullable private final Expression defaultValue;
    private final List<Annotation> metadata;

    public FormalParameter(final SimpleIdentifier identifier, final ParameterKind kind,
                           @Nullable final Expression defaultValue, final List<Annotation> metadata,
                           final SourceSpan span) {
        super(span);
        Preconditions.checkArgument(defaultValue == null || kind.isOptional(),
                                    "Required parameter %s cannot have a default value", identifier);
        this.identifier = identifier;
        this.kind = kind;
        this.defaultValue = defaultValue;
        this.metadata = ImmutableList.copyOf(metadata);
    }

    public SimpleIdentifier getIdentifier() {
        return identifier;
    }

    public String getName() {
        return identifier.getName();
    }

    public ParameterKind getKind() {
        return kind;
    }

    public Optional<Expression> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public List<Annotation> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "FormalParameter{" +
                "name=" + identifier +
                ", kind=" + kind +
                ", defaultValue=" + defaultValue +
                ", metadata=" + metadata +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitFormalParameter(this, context);
    }
}
