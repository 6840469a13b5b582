/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.google.common.base.Stopwatch;
import com.powsybl.math.matrix.LUDecomposition;
import com.powsybl.math.matrix.Matrix;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.math.matrix.MatrixFactory;
import com.powsybl.openth.equations.Variable;
import com.powsybl.openth.equations.Vectors;
import net.jafama.FastMath;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.powsybl.openth.util.Markers.PERFORMANCE_MARKER;

/**
 * Jacobian of the scaled residuals with respect to the free variables, approximated by finite differences: one
 * residual evaluation per column, each perturbation being undone before the next one.
 * <p>
 * A square system is solved by LU decomposition. Otherwise, which happens when some equations are redundant,
 * the step is the least squares solution given by a QR decomposition.
 */
public class JacobianMatrix {

    private static final Logger LOGGER = LoggerFactory.getLogger(JacobianMatrix.class);

    /**
     * Threshold on the diagonal of R, columns being normalized, under which a non square system is considered rank
     * deficient.
     */
    public static final double QR_SINGULARITY_THRESHOLD = 1e-12;

    private final MatrixFactory matrixFactory;

    private final double finiteDifferenceStep;

    private Matrix matrix;

    public JacobianMatrix(MatrixFactory matrixFactory, double finiteDifferenceStep) {
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
        if (finiteDifferenceStep <= 0) {
            throw new IllegalArgumentException("Invalid finite difference step: " + finiteDifferenceStep);
        }
        this.finiteDifferenceStep = finiteDifferenceStep;
    }

    /**
     * Rebuild the matrix around the current value of the variables.
     *
     * @param variables free variables, one per column
     * @param f0 scaled residuals at the current state, one per row
     * @param residuals evaluates the scaled residuals at the current value of the variables
     * @throws MatrixException if a perturbed residual is not finite
     */
    public void update(List<Variable> variables, double[] f0, Supplier<double[]> residuals) {
        Objects.requireNonNull(variables);
        Objects.requireNonNull(f0);
        Objects.requireNonNull(residuals);

        Stopwatch stopwatch = Stopwatch.createStarted();

        matrix = matrixFactory.create(f0.length, variables.size(), f0.length * variables.size());
        for (int column = 0; column < variables.size(); column++) {
            Variable variable = variables.get(column);
            double x0 = variable.getValue();
            double step = finiteDifferenceStep * FastMath.max(1.0, FastMath.abs(x0));
            variable.setValue(x0 + step);
            double delta = variable.getValue() - x0;
            if (delta == 0) {
                // forward step absorbed by the upper bound
                variable.setValue(x0 - step);
                delta = variable.getValue() - x0;
            }
            if (delta == 0) {
                // variable pinned by its bounds, zero column
                variable.setValue(x0);
                continue;
            }
            double[] f1;
            try {
                f1 = residuals.get();
            } finally {
                variable.setValue(x0);
            }
            if (!Vectors.isFinite(f1)) {
                throw new MatrixException("Non finite residual when perturbing variable '" + variable.getName() + "'");
            }
            for (int row = 0; row < f0.length; row++) {
                double value = (f1[row] - f0[row]) / delta;
                if (value != 0) {
                    matrix.set(row, column, value);
                }
            }
        }

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian matrix ({}x{}) built in {} us", f0.length, variables.size(),
                stopwatch.elapsed(TimeUnit.MICROSECONDS));
    }

    public Matrix getMatrix() {
        if (matrix == null) {
            throw new IllegalStateException("Jacobian matrix has not been built");
        }
        return matrix;
    }

    public boolean isSquare() {
        return getMatrix().getRowCount() == getMatrix().getColumnCount();
    }

    /**
     * Solve J dx = b.
     *
     * @return dx, in the least squares sense when the matrix is not square
     * @throws MatrixException if the matrix is singular or rank deficient
     */
    public double[] solve(double[] b) {
        Objects.requireNonNull(b);
        Matrix m = getMatrix();
        if (b.length != m.getRowCount()) {
            throw new IllegalArgumentException("Right hand side length " + b.length + " differs from row count " + m.getRowCount());
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        double[] dx = isSquare() ? solveLu(m, b) : solveLeastSquares(m, b);
        if (!Vectors.isFinite(dx)) {
            throw new MatrixException("Singular Jacobian matrix: non finite step");
        }

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian system solved in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return dx;
    }

    private static double[] solveLu(Matrix m, double[] b) {
        double[] x = b.clone();
        try (LUDecomposition lu = m.decomposeLU()) {
            lu.solve(x);
        } catch (MatrixException e) {
            throw e;
        } catch (RuntimeException e) {
            // the dense implementation reports a singular matrix with a generic exception
            throw new MatrixException("LU decomposition failed: " + e.getMessage());
        }
        return x;
    }

    private static double[] solveLeastSquares(Matrix m, double[] b) {
        int rowCount = m.getRowCount();
        int columnCount = m.getColumnCount();
        if (rowCount < columnCount) {
            throw new MatrixException("Under-determined system: " + rowCount + " equations for " + columnCount + " unknowns");
        }
        var dense = m.toDense();
        // columns are normalized so that the singularity threshold is relative to each unknown
        RealMatrix a = new Array2DRowRealMatrix(rowCount, columnCount);
        double[] columnNorms = new double[columnCount];
        for (int column = 0; column < columnCount; column++) {
            double norm = 0;
            for (int row = 0; row < rowCount; row++) {
                double value = dense.get(row, column);
                norm += value * value;
            }
            norm = FastMath.sqrt(norm);
            if (norm == 0) {
                throw new MatrixException("Rank deficient Jacobian matrix: no equation depends on unknown " + column);
            }
            columnNorms[column] = norm;
            for (int row = 0; row < rowCount; row++) {
                a.setEntry(row, column, dense.get(row, column) / norm);
            }
        }
        double[] x;
        try {
            x = new QRDecomposition(a, QR_SINGULARITY_THRESHOLD)
                    .getSolver()
                    .solve(new ArrayRealVector(b, false))
                    .toArray();
        } catch (SingularMatrixException e) {
            throw new MatrixException("Rank deficient Jacobian matrix: " + e.getMessage());
        }
        for (int column = 0; column < columnCount; column++) {
            x[column] /= columnNorms[column];
        }
        return x;
    }
}
