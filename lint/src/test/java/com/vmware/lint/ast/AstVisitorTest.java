/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstVisitorTest {
    private final AstFixtures ast = new AstFixtures();

    /*
     * Records every identifier it reaches.
     */
    private static class CollectIdentifiers extends SimpleAstVisitor {
        private final List<String> names = new ArrayList<>();

        @Override
        protected VoidType visitSimpleIdentifier(final SimpleIdentifier node, final VoidType context) {
            names.add(node.getName());
            return super.visitSimpleIdentifier(node, context);
        }
    }

    @Test
    public void testTraversalReachesEveryIdentifier() {
        final SimpleIdentifier className = ast.id("C");
        final SimpleIdentifier constructorName = ast.id("C");
        final FormalParameterList constructorParams = ast.params(ast.named("a", ast.annotation("required")));
        final SimpleIdentifier methodName = ast.id("m");
        final FormalParameterList methodParams = ast.params(ast.positional("b"));
        final BlockFunctionBody methodBody = ast.block(ast.local("c", ast.id("b")),
                                                       ast.returns(ast.call("f", ast.id("c"))));
        final CompilationUnit unit = ast.unit(List.of(ast.importMeta()),
                ast.classDecl(className,
                              ast.constructor(constructorName, constructorParams, null),
                              ast.method(methodName, methodParams, methodBody)));
        final CollectIdentifiers visitor = new CollectIdentifiers();
        visitor.visit(unit);
        assertEquals(List.of("C", "C", "a", "m", "b", "c", "b", "f", "c"), visitor.names);
    }

    @Test
    public void testAnnotationNamesAreNotVisited() {
        final FormalParameter parameter = ast.named("a", ast.annotation("meta", "required"));
        final CollectIdentifiers visitor = new CollectIdentifiers();
        visitor.visit(parameter);
        assertEquals(List.of("a"), visitor.names);
    }

    @Test
    public void testDefaultReturnMustBeOverridden() {
        final AstVisitor<String, Void> visitor = new AstVisitor<>();
        assertThrows(UnsupportedOperationException.class, () -> visitor.visit(ast.nullLiteral(), null));
    }

    @Test
    public void testUnParenthesized() {
        final BinaryExpression inner = ast.notNull("a");
        assertSame(inner, ast.paren(ast.paren(inner)).unParenthesized());
        assertSame(inner, inner.unParenthesized());
    }

    @Test
    public void testFunctionLikeBodies() {
        final FunctionExpression literal = ast.function(ast.params(), ast.empty());
        assertTrue(literal.getBody().isPresent());
        final FunctionLike external = ast.method("m", ast.params(), null);
        assertEquals(Optional.empty(), external.getBody());
    }

    @Test
    public void testFunctionLiteralRequiresBody() {
        final FormalParameterList parameters = ast.params();
        final SourceSpan span = new SourceSpan(0, 2);
        assertThrows(NullPointerException.class, () -> new FunctionExpression(parameters, null, span));
    }

    @Test
    public void testSimpleVisitorReturnsNone() {
        assertSame(VoidType.NONE, new CollectIdentifiers().visit(ast.id("a")));
    }

    @Test
    public void testRequiredParameterCannotHaveDefault() {
        final SimpleIdentifier name = ast.id("a");
        final IntegerLiteral value = ast.integer(1);
        assertThrows(IllegalArgumentException.class,
                     () -> new FormalParameter(name, ParameterKind.REQUIRED, value, List.of(), new SourceSpan(0, 3)));
    }

    @Test
    public void testSpans() {
        final SourceSpan span = new SourceSpan(4, 3);
        assertEquals(7, span.getEnd());
        assertEquals(new SourceSpan(4, 3), span);
        assertEquals("[4, 7)", span.toString());
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(0, -1));
    }
}
