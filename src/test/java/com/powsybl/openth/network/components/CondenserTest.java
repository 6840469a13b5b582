/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Outlet pressure and enthalpy closures of a condenser.
 */
class CondenserTest {

    private FluidProperties props;

    private Connection out;

    private Condenser condenser;

    @BeforeEach
    void setUp() {
        props = Mockito.mock(FluidProperties.class);
        when(props.enthalpyPX(eq(0.95e5), eq(0.0))).thenReturn(4e5);
        when(props.enthalpyPX(eq(1e5), eq(0.0))).thenReturn(4.17e5);
        when(props.enthalpyPT(eq(1e5), eq(330.0))).thenReturn(2.4e5);
        out = Connection.create("out", 20, 0.95e5, 4e5);
        condenser = new Condenser("condenser").setPressureDrop(5e3);
        condenser.connectInlet(Condenser.IN, Connection.create("in", 20, 1e5, 2.2e6));
        condenser.connectOutlet(Condenser.OUT, out);
    }

    @Test
    void testSaturatedLiquidOutlet() {
        List<Equation> equations = condenser.equations(props);
        assertEquals(List.of("condenser.mass", "condenser.p_out", "condenser.h_out"), equations.stream().map(Equation::name).toList());
        equations.forEach(e -> assertEquals(0, e.residual(), 1e-9, e.name()));
        assertEquals(20 * (2.2e6 - 4e5), condenser.getHeatRejected(), 1e-6);
    }

    @Test
    void testOutletPressureAndTemperature() {
        condenser.setOutletPressure(1e5).setOutletTemperature(330);
        List<Equation> equations = condenser.equations(props);
        assertEquals(-5e3, equations.get(1).residual(), 1e-9);
        assertEquals(4e5 - 2.4e5, equations.get(2).residual(), 1e-9);

        // a quality target replaces the temperature target
        condenser.setOutletQuality(0);
        assertTrue(Double.isNaN(condenser.getOutletTemperature()));
        assertEquals(4e5 - 4.17e5, condenser.equations(props).get(2).residual(), 1e-9);
    }

    @Test
    void testInvalidQuality() {
        condenser.setOutletQuality(-0.5);
        assertEquals("condenser: outletQuality must be in [0, 1]: -0.5", condenser.validate().get(0).toString());
    }
}
