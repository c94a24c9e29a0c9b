/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.vmware.lint.ast.SourceSpan;

import java.util.Objects;

/**
 * A violation reported by a rule.
 */
public final class Lint {
    private final String ruleName;
    private final String message;
    private final SourceSpan span;

    public Lint(final String ruleName, final String message, final SourceSpan span) {
        this.ruleName = ruleName;
        this.message = message;
        this.span = span;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getMessage() {
        return message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Lint lint = (Lint) o;
        return ruleName.equals(lint.ruleName) && message.equals(lint.message) && span.equals(lint.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, message, span);
    }

    @Override
    public String toString() {
        return "Lint{" +
                "rule=" + ruleName +
                ", message='" + message + '\'' +
                ", span=" + span +
                '}';
    }
}
