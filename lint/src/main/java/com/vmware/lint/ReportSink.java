/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint;

import com.vmware.lint.ast.SourceSpan;

/**
 * Receives one call per violation a rule finds.
 */
@FunctionalInterface
public interface ReportSink {

    void report(SourceSpan span);
}
