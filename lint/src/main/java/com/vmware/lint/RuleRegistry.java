/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.lint.rules.AlwaysRequireNonNullNamedParameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules known to a linter, in registration order. Not thread-safe while rules are being registered.
 */
public class RuleRegistry {
    private final Map<String, LintRule> rules = new LinkedHashMap<>();

    /**
     * @return a registry holding every rule that ships with this library
     */
    public static RuleRegistry withDefaultRules() {
        return new RuleRegistry().register(new AlwaysRequireNonNullNamedParameters());
    }

    @CanIgnoreReturnValue
    public RuleRegistry register(final LintRule rule) {
        if (rules.containsKey(rule.getName())) {
            throw new LintException("Duplicate rule " + rule.getName());
        }
        rules.put(rule.getName(), rule);
        return this;
    }

    public boolean contains(final String name) {
        return rules.containsKey(name);
    }

    public LintRule getRule(final String name) {
        final LintRule rule = rules.get(name);
        if (rule == null) {
            throw new LintException("Unknown rule " + name + ", expected one of " + rules.keySet());
        }
        return rule;
    }

    public List<LintRule> getRules() {
        return new ArrayList<>(rules.values());
    }
}
