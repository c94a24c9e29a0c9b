/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

public enum Group {
    ERRORS("Possible coding errors."),
    STYLE("Matters of style, largely derived from the official Dart Style Guide."),
    PUB("Pub-related rules.");

    private final String description;

    Group(final String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
