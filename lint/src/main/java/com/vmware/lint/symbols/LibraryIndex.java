/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.symbols;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The libraries an {@link ImportedSymbolResolver} knows about, keyed by import URI. Each exported name
 * remembers the library that declares it, which differs from the exporting library for re-exports.
 */
public final class LibraryIndex {
    public static final String META_LIBRARY_URI = "package:meta/meta.dart";
    public static final String META_LIBRARY_NAME = "meta";
    private static final Set<String> META_MEMBERS = ImmutableSet.of("required", "protected", "visibleForTesting",
                                                                    "immutable", "mustCallSuper", "factory",
                                                                    "literal");

    private final Map<String, Library> librariesByUri;

    private LibraryIndex(final Map<String, Library> librariesByUri) {
        this.librariesByUri = ImmutableMap.copyOf(librariesByUri);
    }

    /**
     * @return an index that only contains the {@value #META_LIBRARY_NAME} library
     */
    public static LibraryIndex withMeta() {
        return new Builder().addLibrary(META_LIBRARY_URI, META_LIBRARY_NAME, META_MEMBERS).build();
    }

    public Optional<String> libraryName(final String uri) {
        return Optional.ofNullable(librariesByUri.get(uri)).map(library -> library.name);
    }

    /**
     * @param uri the URI a library is imported by
     * @param member a top-level name
     * @return true if the library behind uri is known and exports member
     */
    public boolean exports(final String uri, final String member) {
        return declaringLibrary(uri, member).isPresent();
    }

    /**
     * @param uri the URI a library is imported by
     * @param member a top-level name
     * @return the name of the library that declares member, if the library behind uri exports it
     */
    public Optional<String> declaringLibrary(final String uri, final String member) {
        return Optional.ofNullable(librariesByUri.get(uri)).map(library -> library.declaredIn.get(member));
    }

    private static final class Library {
        private final String name;
        private final Map<String, String> declaredIn = new LinkedHashMap<>();

        private Library(final String name) {
            this.name = name;
        }
    }

    public static class Builder {
        private final Map<String, Library> libraries = new LinkedHashMap<>();

        /**
         * Registers a library together with the names it declares.
         *
         * @param uri the URI the library is imported by, e.g. {@value LibraryIndex#META_LIBRARY_URI}
         * @param name the library's declared name
         * @param members the top-level names it declares and exports
         * @return the current Builder object with the library added
         */
        @CanIgnoreReturnValue
        public Builder addLibrary(final String uri, final String name, final Set<String> members) {
            Preconditions.checkArgument(!libraries.containsKey(uri), "Library %s registered twice", uri);
            final Library library = new Library(name);
            members.forEach(member -> library.declaredIn.put(member, name));
            libraries.put(uri, library);
            return this;
        }

        /**
         * Makes an already registered library export a name that another library declares, as
         * {@code export 'package:meta/meta.dart' show required;} does.
         *
         * @param uri the URI of the re-exporting library
         * @param declaringLibraryName the name of the library that declares member
         * @param member the re-exported top-level name
         * @return the current Builder object with the re-export added
         */
        @CanIgnoreReturnValue
        public Builder addReexport(final String uri, final String declaringLibraryName, final String member) {
            final Library library = libraries.get(uri);
            Preconditions.checkArgument(library != null, "Library %s is not registered", uri);
            final String previous = library.declaredIn.putIfAbsent(member, declaringLibraryName);
            Preconditions.checkArgument(previous == null || previous.equals(declaringLibraryName),
                                        "Library %s already exports %s from %s", uri, member, previous);
            return this;
        }

        public LibraryIndex build() {
            final Map<String, Library> copy = new LinkedHashMap<>();
            libraries.forEach((uri, library) -> {
                final Library frozen = new Library(library.name);
                frozen.declaredIn.putAll(library.declaredIn);
                copy.put(uri, frozen);
            });
            return new LibraryIndex(copy);
        }
    }
}
