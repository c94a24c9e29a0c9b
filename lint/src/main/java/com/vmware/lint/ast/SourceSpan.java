/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A range of characters within the source a tree was parsed from.
 */
public final class SourceSpan {
    private final int offset;
    private final int length;

    public SourceSpan(final int offset, final int length) {
        Preconditions.checkArgument(offset >= 0, "Negative offset %s", offset);
        Preconditions.checkArgument(length >= 0, "Negative length %s", length);
        this.offset = offset;
        this.length = length;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public int getEnd() {
        return offset + length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SourceSpan that = (SourceSpan) o;
        return offset == that.offset && length == that.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, length);
    }

    @Override
    public String toString() {
        return "[" + offset + ", " + getEnd() + ")";
    }
}
