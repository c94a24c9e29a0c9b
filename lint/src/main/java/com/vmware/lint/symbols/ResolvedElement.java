/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.symbols;

import java.util.Objects;

/**
 * A top-level element of a library that an annotation was resolved to.
 */
public final class ResolvedElement {
    private final String libraryName;
    private final String name;

    public ResolvedElement(final String libraryName, final String name) {
        this.libraryName = libraryName;
        this.name = name;
    }

    public String getLibraryName() {
        return libraryName;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ResolvedElement that = (ResolvedElement) o;
        return libraryName.equals(that.libraryName) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(libraryName, name);
    }

    @Override
    public String toString() {
        return libraryName + "." + name;
    }
}
