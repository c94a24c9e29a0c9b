/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A call such as {@code print('x')} or {@code list.add(e)}.
 */
public class MethodInvocation extends Expression {
    @Nullable private final Expression target;
    private final SimpleIdentifier methodName;
    private final List<Expression> arguments;

    public MethodInvocation(@Nullable final Expression target, final SimpleIdentifier methodName,
                            final List<Expression> arguments, final SourceSpan span) {
        super(span);
        this.target = target;
        this.methodName = methodName;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public Optional<Expression> getTarget() {
        return Optional.ofNullable(target);
    }

    public SimpleIdentifier getMethodName() {
        return methodName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        final String args = arguments.stream().map(Object::toString).collect(Collectors.joining(", "));
        return (target == null ? "" : target + ".") + methodName + "(" + args + ")";
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitMethodInvocation(this, context);
    }
}
