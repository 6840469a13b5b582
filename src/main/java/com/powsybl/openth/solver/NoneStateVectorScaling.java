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

import java.util.function.Function;

/**
 * Full Newton step, whatever the resulting residual norm.
 */
public class NoneStateVectorScaling implements StateVectorScaling {

    @Override
    public StateVectorScalingMode getMode() {
        return StateVectorScalingMode.NONE;
    }

    @Override
    public Step apply(double[] x0, double[] dx, NewtonRaphsonStoppingCriteria.TestResult testResult,
                      Function<double[], NewtonRaphsonStoppingCriteria.TestResult> evaluator, ReportNode reportNode) {
        double[] x = x0.clone();
        Vectors.plus(x, dx, 1);
        return new Step(true, 1, evaluator.apply(x));
    }
}
