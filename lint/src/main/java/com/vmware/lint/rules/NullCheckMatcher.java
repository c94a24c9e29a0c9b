/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.rules;

import com.vmware.lint.ast.BinaryExpression;
import com.vmware.lint.ast.Expression;
import com.vmware.lint.ast.NullLiteral;
import com.vmware.lint.ast.SimpleIdentifier;

import java.util.List;

/*
 * Recognizes `name != null` and `null != name`. Matching is purely by identifier text: a local that shadows the
 * parameter matches too.
 */
final class NullCheckMatcher {

    private NullCheckMatcher() {
    }

    static boolean matchesNotNull(final Expression condition, final String name) {
        if (!(condition instanceof BinaryExpression)) {
            return false;
        }
        final BinaryExpression expression = (BinaryExpression) condition;
        if (expression.getOperator() != BinaryExpression.Operator.NOT_EQUAL) {
            return false;
        }
        final List<Expression> operands = List.of(expression.getLeft(), expression.getRight());
        return operands.stream().anyMatch(e -> e instanceof NullLiteral) &&
               operands.stream().anyMatch(e -> e instanceof SimpleIdentifier
                                               && ((SimpleIdentifier) e).getName().equals(name));
    }
}
