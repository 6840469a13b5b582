/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openth.equations.Vectors;
import com.powsybl.openth.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Backtracking line search: try x0 + mu dx with mu = 1, 1/stepFold, 1/stepFold^2... and accept the first state
 * whose residual norm does not exceed the one at x0. When every trial fails, the state is restored to x0.
 */
public class LineSearchStateVectorScaling implements StateVectorScaling {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineSearchStateVectorScaling.class);

    public static final int DEFAULT_MAX_ITERATION = 14;
    public static final double DEFAULT_STEP_FOLD = 2;

    private final int maxIteration;
    private final double stepFold;

    public LineSearchStateVectorScaling(int maxIteration, double stepFold) {
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Invalid line search max iteration value: " + maxIteration);
        }
        if (stepFold <= 1) {
            throw new IllegalArgumentException("Invalid line search step fold value: " + stepFold);
        }
        this.maxIteration = maxIteration;
        this.stepFold = stepFold;
    }

    @Override
    public StateVectorScalingMode getMode() {
        return StateVectorScalingMode.LINE_SEARCH;
    }

    @Override
    public Step apply(double[] x0, double[] dx, NewtonRaphsonStoppingCriteria.TestResult testResult,
                      Function<double[], NewtonRaphsonStoppingCriteria.TestResult> evaluator, ReportNode reportNode) {
        double stepSize = 1;
        for (int iteration = 1; iteration <= maxIteration; iteration++) {
            double[] x = x0.clone();
            Vectors.plus(x, dx, stepSize);
            NewtonRaphsonStoppingCriteria.TestResult trialResult = evaluator.apply(x);
            // a NaN norm is never accepted
            if (trialResult.getNorm() <= testResult.getNorm()) {
                LOGGER.debug("Step size: {}", stepSize);
                if (reportNode != null) {
                    Reports.reportLineSearchStepSize(reportNode, stepSize);
                }
                return new Step(true, stepSize, trialResult);
            }
            stepSize /= stepFold;
        }
        LOGGER.debug("No step size among {} trials reduces the residual norm {}", maxIteration, testResult.getNorm());
        return new Step(false, 0, evaluator.apply(x0));
    }
}
