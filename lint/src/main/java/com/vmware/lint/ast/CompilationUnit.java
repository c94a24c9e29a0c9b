/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The root of a tree: one parsed source file.
 */
public class CompilationUnit extends AstNode {
    private final String sourceName;
    private final List<ImportDirective> imports;
    private final List<Declaration> declarations;

    public CompilationUnit(final String sourceName, final List<ImportDirective> imports,
                           final List<Declaration> declarations, final SourceSpan span) {
        super(span);
        this.sourceName = sourceName;
        this.imports = ImmutableList.copyOf(imports);
        this.declarations = ImmutableList.copyOf(declarations);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<ImportDirective> getImports() {
        return imports;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public String toString() {
        return "CompilationUnit{" +
                "sourceName='" + sourceName + '\'' +
                ", imports=" + imports +
                ", declarations=" + declarations +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitCompilationUnit(this, context);
    }
}
