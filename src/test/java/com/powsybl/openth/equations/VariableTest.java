/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bounds clipping and fixing of variables.
 */
class VariableTest {

    @Test
    void testClipOnWrite() {
        Variable v = new Variable("c.p", 2e9, false, 1e3, 1e9);
        assertEquals(1e9, v.getValue());
        v.setValue(10);
        assertEquals(1e3, v.getValue());
        v.setValue(5e5);
        assertEquals(5e5, v.getValue());
    }

    @Test
    void testNoBounds() {
        Variable v = new Variable("x", -1e20);
        assertEquals(-1e20, v.getValue());
        assertTrue(Double.isNaN(v.getLowerBound()));
        assertTrue(Double.isNaN(v.getUpperBound()));
        assertFalse(v.isFixed());
    }

    @Test
    void testOneSidedBound() {
        Variable v = new Variable("m", -5, false, 0, Double.NaN);
        assertEquals(0, v.getValue());
        v.setValue(1e12);
        assertEquals(1e12, v.getValue());
    }

    @Test
    void testFixUnfix() {
        Variable v = new Variable("q", 1);
        v.fix(3);
        assertTrue(v.isFixed());
        assertEquals(3, v.getValue());
        v.unfix();
        assertFalse(v.isFixed());
        assertEquals(3, v.getValue());
        v.fix();
        assertTrue(v.isFixed());
    }

    @Test
    void testInvalidBounds() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new Variable("x", 0, false, 2, 1));
        assertEquals("Invalid bounds for variable 'x': [2.0, 1.0]", e.getMessage());
    }
}
