/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import javax.annotation.Nullable;

/**
 * Double-dispatch visitor over the tree. Unless overridden, every method visits the node's children in source
 * order, discards their results and returns {@link #defaultReturn()}.
 *
 * @param <T> result type
 * @param <C> context passed down the traversal
 */
public class AstVisitor<T, C> {

    @Nullable
    public T visit(final AstNode node, @Nullable final C context) {
        return node.acceptVisitor(this, context);
    }

    protected T visitCompilationUnit(final CompilationUnit node, @Nullable final C context) {
        for (final ImportDirective directive: node.getImports()) {
            directive.acceptVisitor(this, context);
        }
        for (final Declaration declaration: node.getDeclarations()) {
            declaration.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    protected T visitImportDirective(final ImportDirective node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitClassDeclaration(final ClassDeclaration node, @Nullable final C context) {
        node.getName().acceptVisitor(this, context);
        for (final Declaration member: node.getMembers()) {
            member.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    protected T visitFunctionDeclaration(final FunctionDeclaration node, @Nullable final C context) {
        node.getName().acceptVisitor(this, context);
        node.getFunction().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitFunctionExpression(final FunctionExpression node, @Nullable final C context) {
        node.getParameters().acceptVisitor(this, context);
        node.getBody().ifPresent(body -> body.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitConstructorDeclaration(final ConstructorDeclaration node, @Nullable final C context) {
        node.getName().acceptVisitor(this, context);
        node.getParameters().acceptVisitor(this, context);
        node.getBody().ifPresent(body -> body.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitMethodDeclaration(final MethodDeclaration node, @Nullable final C context) {
        node.getName().acceptVisitor(this, context);
        node.getParameters().acceptVisitor(this, context);
        node.getBody().ifPresent(body -> body.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitFormalParameterList(final FormalParameterList node, @Nullable final C context) {
        for (final FormalParameter parameter: node.getParameters()) {
            parameter.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    protected T visitFormalParameter(final FormalParameter node, @Nullable final C context) {
        for (final Annotation annotation: node.getMetadata()) {
            annotation.acceptVisitor(this, context);
        }
        node.getIdentifier().acceptVisitor(this, context);
        node.getDefaultValue().ifPresent(value -> value.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitAnnotation(final Annotation node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitBlockFunctionBody(final BlockFunctionBody node, @Nullable final C context) {
        node.getBlock().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitExpressionFunctionBody(final ExpressionFunctionBody node, @Nullable final C context) {
        node.getExpression().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitEmptyFunctionBody(final EmptyFunctionBody node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitBlock(final Block node, @Nullable final C context) {
        for (final Statement statement: node.getStatements()) {
            statement.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    protected T visitAssertStatement(final AssertStatement node, @Nullable final C context) {
        node.getCondition().acceptVisitor(this, context);
        node.getMessage().ifPresent(message -> message.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitExpressionStatement(final ExpressionStatement node, @Nullable final C context) {
        node.getExpression().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitReturnStatement(final ReturnStatement node, @Nullable final C context) {
        node.getExpression().ifPresent(expression -> expression.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitVariableDeclarationStatement(final VariableDeclarationStatement node,
                                                  @Nullable final C context) {
        node.getName().acceptVisitor(this, context);
        node.getInitializer().ifPresent(initializer -> initializer.acceptVisitor(this, context));
        return defaultReturn();
    }

    protected T visitBinaryExpression(final BinaryExpression node, @Nullable final C context) {
        node.getLeft().acceptVisitor(this, context);
        node.getRight().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitPrefixExpression(final PrefixExpression node, @Nullable final C context) {
        node.getOperand().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitParenthesizedExpression(final ParenthesizedExpression node, @Nullable final C context) {
        node.getExpression().acceptVisitor(this, context);
        return defaultReturn();
    }

    protected T visitMethodInvocation(final MethodInvocation node, @Nullable final C context) {
        node.getTarget().ifPresent(target -> target.acceptVisitor(this, context));
        node.getMethodName().acceptVisitor(this, context);
        for (final Expression argument: node.getArguments()) {
            argument.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    protected T visitSimpleIdentifier(final SimpleIdentifier node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitNullLiteral(final NullLiteral node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitBooleanLiteral(final BooleanLiteral node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitIntegerLiteral(final IntegerLiteral node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T visitStringLiteral(final StringLiteral node, @Nullable final C context) {
        return defaultReturn();
    }

    protected T defaultReturn() {
        throw new UnsupportedOperationException();
    }
}
