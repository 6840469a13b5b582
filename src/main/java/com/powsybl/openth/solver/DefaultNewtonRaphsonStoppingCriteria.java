/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.openth.equations.Vectors;

/**
 * Stop when the L2 norm of the scaled residuals is below the tolerance.
 */
public class DefaultNewtonRaphsonStoppingCriteria implements NewtonRaphsonStoppingCriteria {

    private final double tolerance;

    public DefaultNewtonRaphsonStoppingCriteria() {
        this(NewtonRaphsonParameters.DEFAULT_RESIDUAL_TOLERANCE);
    }

    public DefaultNewtonRaphsonStoppingCriteria(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public TestResult test(double[] fx) {
        double norm = Vectors.norm2(fx);
        return new TestResult(norm < tolerance, norm);
    }
}
