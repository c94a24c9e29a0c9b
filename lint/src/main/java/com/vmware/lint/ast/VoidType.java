/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

/**
 * Result and context type of visitors that only walk the tree for side effects.
 */
public enum VoidType {
    NONE
}
