/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.DenseMatrixFactory;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.openth.equations.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Finite difference Jacobian and its LU and least squares solves.
 */
class JacobianMatrixTest {

    private JacobianMatrix j;

    @BeforeEach
    void setUp() {
        j = new JacobianMatrix(new DenseMatrixFactory(), 1e-6);
    }

    @Test
    void testLinearSystem() {
        Variable x = new Variable("x", 2);
        Variable y = new Variable("y", 3);
        Supplier<double[]> f = () -> new double[] {2 * x.getValue() + 3 * y.getValue() - 13, x.getValue() - y.getValue() + 1};
        double[] f0 = f.get();
        j.update(List.of(x, y), f0, f);

        DenseMatrix m = j.getMatrix().toDense();
        assertEquals(2, m.get(0, 0), 1e-6);
        assertEquals(3, m.get(0, 1), 1e-6);
        assertEquals(1, m.get(1, 0), 1e-6);
        assertEquals(-1, m.get(1, 1), 1e-6);
        assertTrue(j.isSquare());
        // perturbations are undone
        assertEquals(2, x.getValue());
        assertEquals(3, y.getValue());

        double[] dx = j.solve(new double[] {-8, 0});
        assertArrayEquals(new double[] {-1.6, -1.6}, dx, 1e-6);
    }

    @Test
    void testBackwardStepAtUpperBound() {
        Variable x = new Variable("x", 10, false, 0, 10);
        Supplier<double[]> f = () -> new double[] {x.getValue() * x.getValue()};
        j.update(List.of(x), f.get(), f);
        assertEquals(20, j.getMatrix().toDense().get(0, 0), 1e-3);
        assertEquals(10, x.getValue());
    }

    @Test
    void testPinnedVariable() {
        Variable x = new Variable("x", 5, false, 5, 5);
        Variable y = new Variable("y", 1);
        Supplier<double[]> f = () -> new double[] {x.getValue() + y.getValue(), y.getValue()};
        j.update(List.of(x, y), f.get(), f);
        DenseMatrix m = j.getMatrix().toDense();
        assertEquals(0, m.get(0, 0));
        assertEquals(0, m.get(1, 0));
        assertEquals(1, m.get(1, 1), 1e-6);
        assertThrows(MatrixException.class, () -> j.solve(new double[] {1, 1}));
    }

    @Test
    void testNonFiniteResidual() {
        Variable x = new Variable("x", 1);
        double[] f0 = {1};
        MatrixException e = assertThrows(MatrixException.class, () -> j.update(List.of(x), f0, () -> new double[] {Double.NaN}));
        assertEquals("Non finite residual when perturbing variable 'x'", e.getMessage());
        assertEquals(1, x.getValue());
    }

    @Test
    void testOverdeterminedConsistentSystem() {
        Variable x = new Variable("x", 0);
        Variable y = new Variable("y", 0);
        // third row is the sum of the first two
        Supplier<double[]> f = () -> new double[] {x.getValue() - 1, y.getValue() - 2, x.getValue() + y.getValue() - 3};
        double[] f0 = f.get();
        j.update(List.of(x, y), f0, f);
        assertFalse(j.isSquare());
        double[] b = {-f0[0], -f0[1], -f0[2]};
        assertArrayEquals(new double[] {1, 2}, j.solve(b), 1e-6);
    }

    @Test
    void testRankDeficientSystem() {
        Variable x = new Variable("x", 0);
        Variable y = new Variable("y", 0);
        Supplier<double[]> f = () -> new double[] {x.getValue() - 1, x.getValue() - 2, 2 * x.getValue()};
        j.update(List.of(x, y), f.get(), f);
        assertThrows(MatrixException.class, () -> j.solve(new double[] {1, 2, 0}));
    }

    @Test
    void testUnderdeterminedSystem() {
        Variable x = new Variable("x", 0);
        Variable y = new Variable("y", 0);
        Supplier<double[]> f = () -> new double[] {x.getValue() + y.getValue()};
        j.update(List.of(x, y), f.get(), f);
        MatrixException e = assertThrows(MatrixException.class, () -> j.solve(new double[] {1}));
        assertEquals("Under-determined system: 1 equations for 2 unknowns", e.getMessage());
    }

    @Test
    void testInvalidUsage() {
        assertThrows(IllegalStateException.class, () -> j.getMatrix());
        assertThrows(IllegalArgumentException.class, () -> new JacobianMatrix(new DenseMatrixFactory(), 0));
    }
}
