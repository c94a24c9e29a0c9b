/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.rules;

import com.vmware.lint.Group;
import com.vmware.lint.LintRule;
import com.vmware.lint.ReportSink;
import com.vmware.lint.ast.CompilationUnit;
import com.vmware.lint.ast.ConstructorDeclaration;
import com.vmware.lint.ast.Expression;
import com.vmware.lint.ast.FormalParameter;
import com.vmware.lint.ast.FunctionExpression;
import com.vmware.lint.ast.FunctionLike;
import com.vmware.lint.ast.MethodDeclaration;
import com.vmware.lint.ast.SimpleAstVisitor;
import com.vmware.lint.ast.VoidType;
import com.vmware.lint.symbols.SymbolResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Flags named parameters that have no default value and no {@code @required} annotation, but whose function
 * starts by asserting that they are not null. Such parameters are required in practice, and {@code @required}
 * lets callers learn that statically.
 *
 * Only the asserts a body starts with are considered. Every function literal, constructor and method is checked
 * independently, including ones nested inside other functions.
 */
public class AlwaysRequireNonNullNamedParameters extends LintRule {
    public static final String NAME = "always_require_non_null_named_parameters";
    private static final Logger LOG = LoggerFactory.getLogger(AlwaysRequireNonNullNamedParameters.class);
    private static final String DESCRIPTION = "Use @required.";
    private static final String DETAILS =
            "**DO** specify `@required` on named parameter without default value on which an\n" +
            "assert(param != null) is done.\n" +
            "\n" +
            "**GOOD:**\n" +
            "```\n" +
            "m1({@required a}) {\n" +
            "  assert(a != null);\n" +
            "}\n" +
            "\n" +
            "m2({a: 1}) {\n" +
            "  assert(a != null);\n" +
            "}\n" +
            "```\n" +
            "\n" +
            "**BAD:**\n" +
            "```\n" +
            "m1({a}) {\n" +
            "  assert(a != null);\n" +
            "}\n" +
            "```\n" +
            "\n" +
            "NOTE: Only asserts at the start of the bodies will be taken into account.\n";

    public AlwaysRequireNonNullNamedParameters() {
        super(NAME, DESCRIPTION, DETAILS, Group.STYLE);
    }

    @Override
    public void analyze(final CompilationUnit unit, final ReportSink sink, final SymbolResolver resolver) {
        new FunctionLikeVisitor(sink, resolver).visit(unit);
    }

    /*
     * Checks each function-like node before descending into it, so reports come out in source order.
     */
    private static class FunctionLikeVisitor extends SimpleAstVisitor {
        private final ReportSink sink;
        private final SymbolResolver resolver;

        private FunctionLikeVisitor(final ReportSink sink, final SymbolResolver resolver) {
            this.sink = sink;
            this.resolver = resolver;
        }

        @Override
        protected VoidType visitFunctionExpression(final FunctionExpression node, final VoidType context) {
            checkParameters(node);
            return super.visitFunctionExpression(node, context);
        }

        @Override
        protected VoidType visitConstructorDeclaration(final ConstructorDeclaration node, final VoidType context) {
            checkParameters(node);
            return super.visitConstructorDeclaration(node, context);
        }

        @Override
        protected VoidType visitMethodDeclaration(final MethodDeclaration node, final VoidType context) {
            checkParameters(node);
            return super.visitMethodDeclaration(node, context);
        }

        private void checkParameters(final FunctionLike node) {
            final List<FormalParameter> parameters = ParameterClassifier.classify(node.getParameters(), resolver);
            if (parameters.isEmpty()) {
                return;
            }
            final List<Expression> asserts = AssertionPrefixScanner.leadingAssertions(node.getBody());
            if (asserts.isEmpty()) {
                return;
            }
            for (final FormalParameter parameter: parameters) {
                if (asserts.stream().anyMatch(e -> NullCheckMatcher.matchesNotNull(e, parameter.getName()))) {
                    LOG.trace("Named parameter {} is asserted non-null but not marked @required", parameter);
                    sink.report(parameter.getIdentifier().getSpan());
                }
            }
        }
    }
}
