/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.google.common.collect.ImmutableList;
import com.vmware.lint.ast.CompilationUnit;
import com.vmware.lint.symbols.SymbolResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a set of lint rules over compilation units.
 *
 * A Linter holds no state between calls to {@link #lint}, so it may be shared across threads as long as the
 * trees and resolvers handed to it allow concurrent reads.
 */
public class Linter {
    private static final Logger LOG = LoggerFactory.getLogger(Linter.class);
    private static final Comparator<Lint> BY_POSITION = Comparator.comparingInt((Lint l) -> l.getSpan().getOffset())
                                                                  .thenComparingInt(l -> l.getSpan().getLength());
    private final List<LintRule> rules;

    public Linter(final LinterOptions options) {
        this.rules = options.getRules();
    }

    /**
     * @return a linter running every default rule
     */
    public static Linter withDefaultRules() {
        return new Linter(new LinterOptions.Builder().build());
    }

    public List<LintRule> getRules() {
        return rules;
    }

    /**
     * Lints a single compilation unit.
     *
     * @param unit the tree to lint
     * @param resolver resolves annotations within unit
     * @return every lint found, sorted by source position. Lints at the same position keep the order in which
     *         rules reported them.
     */
    public List<Lint> lint(final CompilationUnit unit, final SymbolResolver resolver) {
        final List<Lint> lints = new ArrayList<>();
        for (final LintRule rule: rules) {
            final int before = lints.size();
            rule.analyze(unit, span -> lints.add(new Lint(rule.getName(), rule.getDescription(), span)), resolver);
            LOG.debug("Rule {} reported {} lints in {}", rule.getName(), lints.size() - before,
                      unit.getSourceName());
        }
        lints.sort(BY_POSITION);
        return ImmutableList.copyOf(lints);
    }
}
