/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Metadata attached to a declaration, e.g. {@code @required} or {@code @meta.required}. Which element an
 * annotation refers to is decided by a {@link com.vmware.lint.symbols.SymbolResolver}, not by the tree.
 */
public class Annotation extends AstNode {
    @Nullable private final String prefix;
    private final SimpleIdentifier name;

    public Annotation(@Nullable final String prefix, final SimpleIdentifier name, final SourceSpan span) {
        super(span);
        this.prefix = prefix;
        this.name = name;
    }

    public Annotation(final SimpleIdentifier name, final SourceSpan span) {
        this(null, name, span);
    }

    /**
     * @return the import prefix the annotation is qualified with, if any
     */
    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    public SimpleIdentifier getName() {
        return name;
    }

    @Override
    public String toString() {
        return "@" + (prefix == null ? "" : prefix + ".") + name;
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitAnnotation(this, context);
    }
}
