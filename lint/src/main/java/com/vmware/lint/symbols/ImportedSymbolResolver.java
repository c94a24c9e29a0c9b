/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.symbols;

import com.vmware.lint.ast.Annotation;
import com.vmware.lint.ast.CompilationUnit;
import com.vmware.lint.ast.ImportDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves annotations against the imports of a single compilation unit. This is enough for hosts that parse
 * files but do not run a full element model.
 *
 * An unqualified annotation {@code @name} resolves if the libraries imported without a prefix that export
 * {@code name} all export the same element, named after the library that declares it. A qualified annotation
 * {@code @p.name} only looks at imports declared {@code as p}. Names that are exported by no import, or that
 * stand for elements declared in different libraries, stay unresolved. Local declarations are not considered.
 */
public class ImportedSymbolResolver implements SymbolResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ImportedSymbolResolver.class);
    private final List<ImportDirective> imports;
    private final LibraryIndex index;

    public ImportedSymbolResolver(final CompilationUnit unit, final LibraryIndex index) {
        this.imports = unit.getImports();
        this.index = index;
    }

    @Override
    public Optional<ResolvedElement> resolve(final Annotation annotation) {
        final String member = annotation.getName().getName();
        final Optional<String> prefix = annotation.getPrefix();
        final Set<ResolvedElement> candidates = imports.stream()
                .filter(directive -> directive.getPrefix().equals(prefix))
                .map(directive -> index.declaringLibrary(directive.getUri(), member))
                .flatMap(Optional::stream)
                .map(library -> new ResolvedElement(library, member))
                .collect(Collectors.toSet());
        if (candidates.size() != 1) {
            LOG.trace("{} resolves to {} elements: {}", annotation, candidates.size(), candidates);
            return Optional.empty();
        }
        return Optional.of(candidates.iterator().next());
    }
}
