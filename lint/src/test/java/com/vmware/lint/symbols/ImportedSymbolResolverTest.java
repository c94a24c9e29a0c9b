/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.symbols;

import com.vmware.lint.ast.AstFixtures;
import com.vmware.lint.ast.CompilationUnit;
import com.vmware.lint.ast.ImportDirective;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ImportedSymbolResolverTest {
    private static final String OTHER_URI = "package:other/other.dart";
    private static final String FOUNDATION_URI = "package:flutter/foundation.dart";
    private final AstFixtures ast = new AstFixtures();
    private final LibraryIndex index = new LibraryIndex.Builder()
            .addLibrary(LibraryIndex.META_LIBRARY_URI, LibraryIndex.META_LIBRARY_NAME, Set.of("required", "protected"))
            .addLibrary(OTHER_URI, "other", Set.of("required", "deprecated"))
            .addLibrary(FOUNDATION_URI, "foundation", Set.of("kDebugMode"))
            .addReexport(FOUNDATION_URI, LibraryIndex.META_LIBRARY_NAME, "required")
            .build();

    private SymbolResolver resolver(final ImportDirective... imports) {
        final CompilationUnit unit = ast.unit(List.of(imports));
        return new ImportedSymbolResolver(unit, index);
    }

    @Test
    public void testUnprefixedImport() {
        final SymbolResolver resolver = resolver(ast.importMeta());
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("required")));
        assertEquals(Optional.of(new ResolvedElement("meta", "protected")),
                     resolver.resolve(ast.annotation("protected")));
    }

    @Test
    public void testNotExported() {
        final SymbolResolver resolver = resolver(ast.importMeta());
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("deprecated")));
    }

    @Test
    public void testNothingImported() {
        assertEquals(Optional.empty(), resolver().resolve(ast.annotation("required")));
    }

    @Test
    public void testUnknownLibrary() {
        final SymbolResolver resolver = resolver(ast.importDirective("package:unknown/unknown.dart", null));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("required")));
    }

    @Test
    public void testPrefixedImport() {
        final SymbolResolver resolver = resolver(ast.importDirective(LibraryIndex.META_LIBRARY_URI, "m"));
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("m", "required")));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("required")));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("x", "required")));
    }

    @Test
    public void testAmbiguousName() {
        final SymbolResolver resolver = resolver(ast.importMeta(), ast.importDirective(OTHER_URI, null));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("required")));
        assertEquals(Optional.of(new ResolvedElement("other", "deprecated")),
                     resolver.resolve(ast.annotation("deprecated")));
    }

    @Test
    public void testPrefixDisambiguates() {
        final SymbolResolver resolver = resolver(ast.importMeta(), ast.importDirective(OTHER_URI, "other"));
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("required")));
        assertEquals(Optional.of(new ResolvedElement("other", "required")),
                     resolver.resolve(ast.annotation("other", "required")));
    }

    @Test
    public void testDuplicateImportOfSameLibrary() {
        final SymbolResolver resolver = resolver(ast.importMeta(), ast.importMeta());
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("required")));
    }

    @Test
    public void testReexportResolvesToDeclaringLibrary() {
        final SymbolResolver resolver = resolver(ast.importDirective(FOUNDATION_URI, null));
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("required")));
        assertEquals(Optional.of(new ResolvedElement("foundation", "kDebugMode")),
                     resolver.resolve(ast.annotation("kDebugMode")));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("protected")));
    }

    @Test
    public void testSameElementThroughTwoImportsIsNotAmbiguous() {
        final SymbolResolver resolver = resolver(ast.importMeta(), ast.importDirective(FOUNDATION_URI, null));
        assertEquals(Optional.of(new ResolvedElement("meta", "required")),
                     resolver.resolve(ast.annotation("required")));
    }

    @Test
    public void testReexportAndOwnDeclarationAreAmbiguous() {
        final SymbolResolver resolver = resolver(ast.importDirective(FOUNDATION_URI, null),
                                                 ast.importDirective(OTHER_URI, null));
        assertEquals(Optional.empty(), resolver.resolve(ast.annotation("required")));
    }

    @Test
    public void testReexportOfUnknownLibrary() {
        final LibraryIndex.Builder builder = new LibraryIndex.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.addReexport(OTHER_URI, "meta", "required"));
    }

    @Test
    public void testConflictingReexport() {
        final LibraryIndex.Builder builder = new LibraryIndex.Builder().addLibrary(OTHER_URI, "other", Set.of("x"))
                .addReexport(OTHER_URI, "meta", "required")
                .addReexport(OTHER_URI, "meta", "required");
        assertThrows(IllegalArgumentException.class, () -> builder.addReexport(OTHER_URI, "other", "required"));
        assertThrows(IllegalArgumentException.class, () -> builder.addReexport(OTHER_URI, "meta", "x"));
        assertEquals(Optional.of("meta"), builder.build().declaringLibrary(OTHER_URI, "required"));
    }

    @Test
    public void testUnresolved() {
        assertEquals(Optional.empty(), SymbolResolver.unresolved().resolve(ast.annotation("required")));
    }

    @Test
    public void testMetaIndex() {
        final LibraryIndex meta = LibraryIndex.withMeta();
        assertEquals(Optional.of("meta"), meta.libraryName(LibraryIndex.META_LIBRARY_URI));
        assertTrue(meta.exports(LibraryIndex.META_LIBRARY_URI, "required"));
        assertTrue(meta.exports(LibraryIndex.META_LIBRARY_URI, "visibleForTesting"));
        assertFalse(meta.exports(LibraryIndex.META_LIBRARY_URI, "deprecated"));
        assertFalse(meta.exports(OTHER_URI, "required"));
        assertEquals(Optional.of("meta"), meta.declaringLibrary(LibraryIndex.META_LIBRARY_URI, "required"));
        assertEquals(Optional.empty(), meta.declaringLibrary(LibraryIndex.META_LIBRARY_URI, "deprecated"));
        assertEquals(Optional.empty(), meta.libraryName(OTHER_URI));
    }

    @Test
    public void testDuplicateLibrary() {
        final LibraryIndex.Builder builder = new LibraryIndex.Builder().addLibrary(OTHER_URI, "a", Set.of());
        assertThrows(IllegalArgumentException.class, () -> builder.addLibrary(OTHER_URI, "b", Set.of()));
    }
}
