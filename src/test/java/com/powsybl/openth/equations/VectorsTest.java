/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Vector helpers.
 */
class VectorsTest {

    @Test
    void testNorms() {
        double[] v = {3, -4};
        assertEquals(5, Vectors.norm2(v), 1e-15);
        assertEquals(4, Vectors.normInf(v));
        assertEquals(0, Vectors.norm2(new double[0]));
    }

    @Test
    void testPlusAndMult() {
        double[] a = {1, 2};
        Vectors.plus(a, new double[] {1, 1}, 0.5);
        assertArrayEquals(new double[] {1.5, 2.5}, a);
        Vectors.mult(a, -2);
        assertArrayEquals(new double[] {-3, -5}, a);
        assertThrows(IllegalArgumentException.class, () -> Vectors.plus(new double[1], new double[2], 1));
    }

    @Test
    void testIsFinite() {
        assertTrue(Vectors.isFinite(new double[] {0, 1e300}));
        assertFalse(Vectors.isFinite(new double[] {0, Double.NaN}));
        assertFalse(Vectors.isFinite(new double[] {Double.NEGATIVE_INFINITY}));
    }

    @Test
    void testValuesAreClipped() {
        List<Variable> variables = List.of(new Variable("a", 0, false, 0, 10), new Variable("b", 0));
        Vectors.setValues(variables, new double[] {20, -3});
        assertArrayEquals(new double[] {10, -3}, Vectors.getValues(variables));
        assertThrows(IllegalArgumentException.class, () -> Vectors.setValues(variables, new double[3]));
    }

    @Test
    void testScaledResiduals() {
        List<Equation> equations = List.of(Equation.mass("m", 2, 4), Equation.pressure("p", 1e4, 1e5));
        assertArrayEquals(new double[] {0.5, 0.1}, Vectors.getScaledResiduals(equations), 1e-15);
    }
}
