/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Line search step halving and state restoration.
 */
class StateVectorScalingTest {

    private static NewtonRaphsonStoppingCriteria.TestResult distanceTo(double target, double[] x) {
        return new NewtonRaphsonStoppingCriteria.TestResult(false, Math.abs(x[0] - target));
    }

    @Test
    void testFromParameters() {
        assertEquals(StateVectorScalingMode.LINE_SEARCH, StateVectorScaling.fromParameters(new NewtonRaphsonParameters()).getMode());
        assertEquals(StateVectorScalingMode.NONE,
                     StateVectorScaling.fromParameters(new NewtonRaphsonParameters().setDampingEnabled(false)).getMode());
    }

    @Test
    void testFullStep() {
        StateVectorScaling scaling = new NoneStateVectorScaling();
        // full step is taken even when the norm increases
        StateVectorScaling.Step step = scaling.apply(new double[] {0}, new double[] {1}, distanceTo(0.3, new double[] {0}),
                                                     x -> distanceTo(0.3, x), null);
        assertTrue(step.accepted());
        assertEquals(1, step.stepSize());
        assertEquals(0.7, step.testResult().getNorm(), 1e-12);
    }

    @Test
    void testLineSearchHalvesStep() {
        StateVectorScaling scaling = new LineSearchStateVectorScaling(14, 2);
        List<Double> trials = new ArrayList<>();
        StateVectorScaling.Step step = scaling.apply(new double[] {0}, new double[] {1}, distanceTo(0.3, new double[] {0}),
            x -> {
                trials.add(x[0]);
                return distanceTo(0.3, x);
            }, null);
        assertTrue(step.accepted());
        assertEquals(0.5, step.stepSize());
        assertEquals(0.2, step.testResult().getNorm(), 1e-12);
        assertEquals(List.of(1.0, 0.5), trials);
    }

    @Test
    void testLineSearchFailureRestoresState() {
        StateVectorScaling scaling = new LineSearchStateVectorScaling(4, 2);
        List<Double> trials = new ArrayList<>();
        StateVectorScaling.Step step = scaling.apply(new double[] {1}, new double[] {8}, new NewtonRaphsonStoppingCriteria.TestResult(false, 1),
            x -> {
                trials.add(x[0]);
                return new NewtonRaphsonStoppingCriteria.TestResult(false, 10);
            }, null);
        assertFalse(step.accepted());
        assertEquals(0, step.stepSize());
        assertEquals(List.of(9.0, 5.0, 3.0, 2.0, 1.0), trials);
    }

    @Test
    void testNanNormIsRejected() {
        StateVectorScaling scaling = new LineSearchStateVectorScaling(2, 2);
        StateVectorScaling.Step step = scaling.apply(new double[] {0}, new double[] {1}, new NewtonRaphsonStoppingCriteria.TestResult(false, 1),
            x -> new NewtonRaphsonStoppingCriteria.TestResult(false, x[0] > 0.9 ? Double.NaN : 0.5), null);
        assertTrue(step.accepted());
        assertEquals(0.5, step.stepSize());
    }

    @Test
    void testInvalidLineSearchParameters() {
        assertThrows(IllegalArgumentException.class, () -> new LineSearchStateVectorScaling(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new LineSearchStateVectorScaling(3, 1));
    }

    @Test
    void testStoppingCriteria() {
        double[] fx = {3e-8, -4e-8};
        NewtonRaphsonStoppingCriteria.TestResult l2 = new DefaultNewtonRaphsonStoppingCriteria(4e-8).test(fx);
        assertFalse(l2.isStop());
        assertEquals(5e-8, l2.getNorm(), 1e-20);
        NewtonRaphsonStoppingCriteria.TestResult perEquation = new PerEquationStoppingCriteria(4.5e-8).test(fx);
        assertTrue(perEquation.isStop());
        assertEquals(5e-8, perEquation.getNorm(), 1e-20);
        assertFalse(new DefaultNewtonRaphsonStoppingCriteria().test(new double[] {Double.NaN}).isStop());
    }
}
