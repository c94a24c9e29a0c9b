/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * An immutable, read-only view of a parsed Dart-like program. Hosts build these nodes from their own parser
 * output; lint rules only read them.
 */

@ParametersAreNonnullByDefault

package com.vmware.lint.ast;

import javax.annotation.ParametersAreNonnullByDefault;
