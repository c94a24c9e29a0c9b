/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * This informs FindBugs to mark parameters as NonNull.
 */

@ParametersAreNonnullByDefault

package com.vmware.lint;

import javax.annotation.ParametersAreNonnullByDefault;
