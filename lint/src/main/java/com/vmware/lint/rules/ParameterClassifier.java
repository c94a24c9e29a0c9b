/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.rules;

import com.vmware.lint.ast.Annotation;
import com.vmware.lint.ast.FormalParameter;
import com.vmware.lint.ast.FormalParameterList;
import com.vmware.lint.ast.ParameterKind;
import com.vmware.lint.symbols.ResolvedElement;
import com.vmware.lint.symbols.SymbolResolver;

import java.util.List;
import java.util.stream.Collectors;

/*
 * Selects the named parameters that have neither a default value nor a @required annotation.
 */
final class ParameterClassifier {

    /**
     * The name of the `meta` library, used to define analysis annotations.
     */
    static final String META_LIB_NAME = "meta";

    /**
     * The name of the top-level variable used to mark a required named parameter.
     */
    static final String REQUIRED_VAR_NAME = "required";

    private ParameterClassifier() {
    }

    static List<FormalParameter> classify(final FormalParameterList parameterList, final SymbolResolver resolver) {
        return parameterList.getParameters().stream()
                .filter(parameter -> parameter.getKind() == ParameterKind.NAMED)
                .filter(parameter -> parameter.getDefaultValue().isEmpty())
                .filter(parameter -> parameter.getMetadata().stream().noneMatch(a -> isRequired(a, resolver)))
                .collect(Collectors.toList());
    }

    private static boolean isRequired(final Annotation annotation, final SymbolResolver resolver) {
        return resolver.resolve(annotation)
                .map(ParameterClassifier::isRequiredMarker)
                .orElse(false);
    }

    private static boolean isRequiredMarker(final ResolvedElement element) {
        return REQUIRED_VAR_NAME.equals(element.getName()) && META_LIB_NAME.equals(element.getLibraryName());
    }
}
