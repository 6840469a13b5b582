/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.commons.report.ReportNode;

import java.util.Objects;
import java.util.function.Function;

/**
 * Decide how much of a Newton step is applied to the state vector.
 */
public interface StateVectorScaling {

    /**
     * Outcome of a scaled step.
     *
     * @param accepted false when no acceptable state has been found, the state being then restored
     * @param stepSize fraction of the Newton step applied
     * @param testResult stopping criteria test at the resulting state
     */
    record Step(boolean accepted, double stepSize, NewtonRaphsonStoppingCriteria.TestResult testResult) {
    }

    static StateVectorScaling fromParameters(NewtonRaphsonParameters parameters) {
        Objects.requireNonNull(parameters);
        return switch (parameters.getStateVectorScalingMode()) {
            case NONE -> new NoneStateVectorScaling();
            case LINE_SEARCH -> new LineSearchStateVectorScaling(parameters.getLineSearchMaxIterations(),
                                                                 parameters.getLineSearchStepFold());
        };
    }

    StateVectorScalingMode getMode();

    /**
     * Move the state from x0 along dx.
     *
     * @param x0 state before the step
     * @param dx Newton step
     * @param testResult stopping criteria test at x0
     * @param evaluator writes a state and tests the stopping criteria at it
     * @param reportNode iteration report node, null when not reporting
     */
    Step apply(double[] x0, double[] dx, NewtonRaphsonStoppingCriteria.TestResult testResult,
               Function<double[], NewtonRaphsonStoppingCriteria.TestResult> evaluator, ReportNode reportNode);
}
