/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

/**
 * Callbacks on the progress of a Newton-Raphson run.
 */
public interface NewtonRaphsonObserver {

    default void beginIteration(int iteration) {
        // empty
    }

    /**
     * Called once a step has been accepted.
     *
     * @param iteration iteration number, starting at 1
     * @param normBefore scaled residual norm before the step
     * @param normAfter scaled residual norm after the step
     * @param stepSize fraction of the Newton step which has been applied
     */
    default void afterStep(int iteration, double normBefore, double normAfter, double stepSize) {
        // empty
    }

    default void end(NewtonRaphsonResult result) {
        // empty
    }
}
