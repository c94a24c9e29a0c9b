/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.lint.ast;

import java.util.Optional;

/**
 * Implemented by every node that declares a parameter list and may carry a body: function literals,
 * constructors and methods.
 */
public interface FunctionLike {

    FormalParameterList getParameters();

    /**
     * @return the body, or empty for declarations that have none (e.g. external members)
     */
    Optional<FunctionBody> getBody();
}
