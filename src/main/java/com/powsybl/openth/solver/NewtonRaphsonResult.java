/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import java.util.Objects;

/**
 * Outcome of a Newton-Raphson run: status, number of iterations, residual norm of the last state and a
 * diagnostic message. Numerical failures are reported here, never thrown.
 */
public class NewtonRaphsonResult {

    private final NewtonRaphsonStatus status;

    private final int iterations;

    private final double residualNorm;

    private final String message;

    public NewtonRaphsonResult(NewtonRaphsonStatus status, int iterations, double residualNorm, String message) {
        if (iterations < 0) {
            throw new IllegalArgumentException("Invalid iteration value: " + iterations);
        }
        this.status = Objects.requireNonNull(status);
        this.iterations = iterations;
        this.residualNorm = residualNorm;
        this.message = Objects.requireNonNull(message);
    }

    public boolean isConverged() {
        return status == NewtonRaphsonStatus.CONVERGED;
    }

    public NewtonRaphsonStatus getStatus() {
        return status;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * L2 norm of the scaled residuals at the final state.
     */
    public double getResidualNorm() {
        return residualNorm;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "NewtonRaphsonResult(" +
                "status=" + status +
                ", iterations=" + iterations +
                ", residualNorm=" + residualNorm +
                ", message=" + message +
                ')';
    }
}
