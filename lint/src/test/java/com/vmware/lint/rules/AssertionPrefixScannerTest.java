/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.rules;

import com.vmware.lint.ast.AstFixtures;
import com.vmware.lint.ast.BinaryExpression;
import com.vmware.lint.ast.Expression;
import com.vmware.lint.ast.FunctionBody;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AssertionPrefixScannerTest {
    private final AstFixtures ast = new AstFixtures();

    @Test
    public void testAbsentBody() {
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.empty()).isEmpty());
    }

    @Test
    public void testNonBlockBodies() {
        final FunctionBody arrow = ast.arrow(ast.notNull("a"));
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.of(arrow)).isEmpty());
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.of(ast.empty())).isEmpty());
    }

    @Test
    public void testEmptyBlock() {
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.of(ast.block())).isEmpty());
    }

    @Test
    public void testWholeBlockOfAsserts() {
        final BinaryExpression first = ast.notNull("a");
        final BinaryExpression second = ast.notNull("b");
        final FunctionBody body = ast.block(ast.assertThat(first), ast.assertThat(second, ast.string("b")));
        assertEquals(List.of(first, second), AssertionPrefixScanner.leadingAssertions(Optional.of(body)));
    }

    @Test
    public void testStopsAtFirstOtherStatement() {
        final BinaryExpression first = ast.notNull("a");
        final FunctionBody body = ast.block(ast.assertThat(first),
                                            ast.print("x"),
                                            ast.assertThat(ast.notNull("b")));
        assertEquals(List.of(first), AssertionPrefixScanner.leadingAssertions(Optional.of(body)));
    }

    @Test
    public void testLeadingOtherStatement() {
        final FunctionBody body = ast.block(ast.print("x"), ast.assertThat(ast.notNull("a")));
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.of(body)).isEmpty());
    }

    @Test
    public void testNestedBlockEndsPrefix() {
        final FunctionBody body = ast.block(ast.nestedBlock(ast.assertThat(ast.notNull("a"))));
        assertTrue(AssertionPrefixScanner.leadingAssertions(Optional.of(body)).isEmpty());
    }

    @Test
    public void testConditionsAreUnparenthesized() {
        final BinaryExpression condition = ast.notNull("a");
        final FunctionBody body = ast.block(ast.assertThat(ast.paren(ast.paren(condition))));
        final List<Expression> conditions = AssertionPrefixScanner.leadingAssertions(Optional.of(body));
        assertEquals(1, conditions.size());
        assertSame(condition, conditions.get(0));
    }
}
