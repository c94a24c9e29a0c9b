/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configures which rules a {@link Linter} runs.
 */
public final class LinterOptions {
    private final List<LintRule> rules;

    private LinterOptions(final List<LintRule> rules) {
        this.rules = ImmutableList.copyOf(rules);
    }

    /**
     * @return the enabled rules, in the order they were registered
     */
    public List<LintRule> getRules() {
        return rules;
    }

    public static class Builder {
        @Nullable private Set<String> enabledRules = null;
        @Nullable private RuleRegistry registry = null;

        /**
         * Rules to run, by name.
         * @param enabledRules names of registered rules. Defaults to every registered rule.
         * @return the current Builder object with `enabledRules` set
         */
        @CanIgnoreReturnValue
        public Builder setEnabledRules(final Collection<String> enabledRules) {
            this.enabledRules = ImmutableSet.copyOf(enabledRules);
            return this;
        }

        /**
         * Where rules are looked up.
         * @param registry the registry to use. Defaults to {@link RuleRegistry#withDefaultRules()}.
         * @return the current Builder object with `registry` set
         */
        @CanIgnoreReturnValue
        public Builder setRegistry(final RuleRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * @return options holding the enabled rules
         * @throws LintException if an enabled rule is not registered, or if no rule ends up enabled
         */
        public LinterOptions build() {
            final RuleRegistry rulesSource = registry == null ? RuleRegistry.withDefaultRules() : registry;
            final List<LintRule> rules;
            if (enabledRules == null) {
                rules = rulesSource.getRules();
            } else {
                enabledRules.forEach(rulesSource::getRule);
                rules = rulesSource.getRules().stream()
                        .filter(rule -> enabledRules.contains(rule.getName()))
                        .collect(Collectors.toList());
            }
            if (rules.isEmpty()) {
                throw new LintException("No lint rules enabled");
            }
            return new LinterOptions(rules);
        }
    }
}
