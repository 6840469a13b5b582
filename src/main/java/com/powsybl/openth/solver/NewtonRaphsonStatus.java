/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

/**
 * Terminal status of a Newton-Raphson run.
 */
public enum NewtonRaphsonStatus {
    CONVERGED,
    /**
     * Nothing to solve and the fixed state does not meet the tolerance.
     */
    NO_CALCULATION,
    /**
     * The linearized system could not be solved.
     */
    SOLVER_FAILED,
    /**
     * The line search could not reduce the residual norm.
     */
    STAGNATION,
    MAX_ITERATION_REACHED
}
