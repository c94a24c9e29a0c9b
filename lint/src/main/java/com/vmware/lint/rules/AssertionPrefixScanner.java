/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.rules;

import com.vmware.lint.ast.AssertStatement;
import com.vmware.lint.ast.BlockFunctionBody;
import com.vmware.lint.ast.Expression;
import com.vmware.lint.ast.FunctionBody;
import com.vmware.lint.ast.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/*
 * Extracts the conditions of the asserts a body starts with. Scanning stops at the first statement that is not
 * an assert.
 */
final class AssertionPrefixScanner {

    private AssertionPrefixScanner() {
    }

    static List<Expression> leadingAssertions(final Optional<FunctionBody> body) {
        if (body.isEmpty() || !(body.get() instanceof BlockFunctionBody)) {
            return Collections.emptyList();
        }
        final List<Statement> statements = ((BlockFunctionBody) body.get()).getBlock().getStatements();
        final List<Expression> conditions = new ArrayList<>();
        for (final Statement statement: statements) {
            if (!(statement instanceof AssertStatement)) {
                break;
            }
            conditions.add(((AssertStatement) statement).getCondition().unParenthesized());
        }
        return conditions;
    }
}
