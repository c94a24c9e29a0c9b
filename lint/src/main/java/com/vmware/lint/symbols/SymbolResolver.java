/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.symbols;

import com.vmware.lint.ast.Annotation;

import java.util.Optional;

/**
 * Supplied by the host to tell lint rules which library element an annotation refers to.
 */
@FunctionalInterface
public interface SymbolResolver {

    /**
     * @param annotation an annotation attached to some declaration in the tree being linted
     * @return the element the annotation refers to, or empty if it cannot be resolved
     */
    Optional<ResolvedElement> resolve(Annotation annotation);

    /**
     * @return a resolver for which every annotation is unresolved
     */
    static SymbolResolver unresolved() {
        return annotation -> Optional.empty();
    }
}
