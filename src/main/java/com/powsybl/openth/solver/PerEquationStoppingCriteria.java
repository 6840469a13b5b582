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
 * Stop when every scaled residual is below the tolerance in absolute value.
 */
public class PerEquationStoppingCriteria implements NewtonRaphsonStoppingCriteria {

    private final double tolerance;

    public PerEquationStoppingCriteria(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public TestResult test(double[] fx) {
        return new TestResult(Vectors.normInf(fx) < tolerance, Vectors.norm2(fx));
    }
}
