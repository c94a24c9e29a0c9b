/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

@ParametersAreNonnullByDefault

package com.vmware.lint.rules;

import javax.annotation.ParametersAreNonnullByDefault;
