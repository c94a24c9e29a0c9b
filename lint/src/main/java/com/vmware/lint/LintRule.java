/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.google.common.base.Preconditions;
import com.vmware.lint.ast.CompilationUnit;
import com.vmware.lint.symbols.SymbolResolver;

/**
 * A single check over a syntax tree. Rules hold no per-run state, so one instance may lint many trees, also
 * concurrently.
 */
public abstract class LintRule {
    private final String name;
    private final String description;
    private final String details;
    private final Group group;

    protected LintRule(final String name, final String description, final String details, final Group group) {
        Preconditions.checkArgument(!name.isEmpty(), "Rule name must not be empty");
        this.name = name;
        this.description = description;
        this.details = details;
        this.group = group;
    }

    /**
     * @return the identifier users refer to this rule by, e.g. in configuration
     */
    public String getName() {
        return name;
    }

    /**
     * @return a one line summary, used as the message of every lint the rule reports
     */
    public String getDescription() {
        return description;
    }

    /**
     * @return longer documentation, with examples of good and bad code
     */
    public String getDetails() {
        return details;
    }

    public Group getGroup() {
        return group;
    }

    /**
     * Analyzes a tree and reports each violation to sink. Exceptions thrown by sink or resolver are not caught.
     *
     * @param unit the tree to check
     * @param sink receives the span of every violation, in traversal order
     * @param resolver resolves annotations found in the tree
     */
    public abstract void analyze(CompilationUnit unit, ReportSink sink, SymbolResolver resolver);

    @Override
    public String toString() {
        return name;
    }
}
