/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

public enum ParameterKind {
    /**
     * A positional parameter that callers must always pass.
     */
    REQUIRED,

    /**
     * An optional positional parameter, declared within {@code [...]}.
     */
    POSITIONAL,

    /**
     * An optional parameter passed by name, declared within <code>{...}</code>.
     */
    NAMED;

    public boolean isOptional() {
        return this != REQUIRED;
    }
}
