/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * {@code import 'uri';} or {@code import 'uri' as prefix;}.
 */
public class ImportDirective extends AstNode {
    private final String uri;
    @Nullable private final String prefix;

    public ImportDirective(final String uri, @Nullable final String prefix, final SourceSpan span) {
        super(span);
        this.uri = uri;
        this.prefix = prefix;
    }

    public String getUri() {
        return uri;
    }

    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    @Override
    public String toString() {
        return "import '" + uri + "'" + (prefix == null ? "" : " as " + prefix) + ";";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitImportDirective(this, context);
    }
}
