/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

/**
 * Thrown when a linter is misconfigured, for example when it is asked for a rule that was never registered.
 */
public class LintException extends RuntimeException {
    public LintException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public LintException(final String message) {
        super(message);
    }
}
