/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Resolution of annotations to the library elements they refer to.
 */

@ParametersAreNonnullByDefault

package com.vmware.lint.symbols;

import javax.annotation.ParametersAreNonnullByDefault;
