/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Laminar and Haaland friction factors.
 */
class FrictionFactorsTest {

    @Test
    void testFluidAtRest() {
        assertEquals(0, FrictionFactors.haaland(0, 1e-4));
    }

    @Test
    void testLaminar() {
        assertEquals(0.064, FrictionFactors.haaland(1000, 1e-2), 1e-15);
        assertEquals(0.064, FrictionFactors.haaland(-1000, 1e-2), 1e-15);
    }

    @Test
    void testTurbulentSmoothPipe() {
        assertEquals(0.017825, FrictionFactors.haaland(1e5, 0), 1e-5);
    }

    @Test
    void testRoughnessIncreasesFriction() {
        double smooth = FrictionFactors.haaland(1e6, 0);
        double rough = FrictionFactors.haaland(1e6, 1e-3);
        assertTrue(rough > smooth);
        // fully rough regime barely depends on the Reynolds number
        assertEquals(FrictionFactors.haaland(1e7, 1e-2), FrictionFactors.haaland(1e8, 1e-2), 1e-3);
    }
}
