/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.network.ConfigurationException;
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
 * Outlet pressure and enthalpy closures of a heater.
 */
class HeaterTest {

    private FluidProperties props;

    private Connection out;

    private Heater heater;

    @BeforeEach
    void setUp() {
        props = Mockito.mock(FluidProperties.class);
        when(props.enthalpyPT(eq(6.9e6), eq(450.0))).thenReturn(7.5e5);
        out = Connection.create("out", 20, 6.9e6, 7.5e5);
        heater = new Heater("heater").setPressureDrop(1e5);
        heater.connectInlet(Heater.IN, Connection.create("in", 20, 7e6, 4.3e5));
        heater.connectOutlet(Heater.OUT, out);
    }

    @Test
    void testNoTarget() {
        assertEquals(1, heater.validate().size());
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> heater.equations(props));
        assertEquals("heater: outletTemperature or outletQuality or outletEnthalpy must be specified", e.getMessage());
    }

    @Test
    void testTemperatureTarget() {
        heater.setOutletTemperature(450);
        List<Equation> equations = heater.equations(props);
        assertEquals(List.of("heater.mass", "heater.p_out", "heater.h_out"), equations.stream().map(Equation::name).toList());
        equations.forEach(e -> assertEquals(0, e.residual(), 1e-9, e.name()));
        assertEquals(20 * (7.5e5 - 4.3e5), heater.getHeatAdded(), 1e-6);
    }

    @Test
    void testTargetsReplaceEachOther() {
        heater.setOutletTemperature(450).setOutletEnthalpy(8e5);
        assertTrue(Double.isNaN(heater.getOutletTemperature()));
        assertEquals(-5e4, heater.equations(props).get(2).residual(), 1e-9);
        heater.setOutletTemperature(450);
        assertTrue(Double.isNaN(heater.getOutletEnthalpy()));
        assertEquals(0, heater.equations(props).get(2).residual(), 1e-9);
    }

    @Test
    void testFixedOutletPressure() {
        // outlet anchored below the inlet pressure without any pressure drop
        when(props.enthalpyPT(eq(6.5e6), eq(450.0))).thenReturn(7.49e5);
        heater.setPressureDrop(0).setOutletPressure(6.5e6).setOutletTemperature(450);
        out.guess(null, 6.5e6, 7.49e5);
        List<Equation> equations = heater.equations(props);
        equations.forEach(e -> assertEquals(0, e.residual(), 1e-9, e.name()));

        heater.setOutletPressure(Double.NaN);
        assertEquals(-5e5, heater.equations(props).get(1).residual(), 1e-9);
    }

    @Test
    void testQualityTarget() {
        when(props.enthalpyPX(eq(6.9e6), eq(0.1))).thenReturn(1.41e6);
        heater.setOutletQuality(0.1);
        assertTrue(heater.validate().isEmpty());
        assertEquals(1.41e6 - 7.5e5, -heater.equations(props).get(2).residual(), 1e-9);
        out.guess(null, null, 1.41e6);
        assertEquals(0, heater.equations(props).get(2).residual(), 1e-9);
    }

    @Test
    void testQualityReplacesOtherTargets() {
        heater.setOutletEnthalpy(8e5).setOutletQuality(0);
        assertTrue(Double.isNaN(heater.getOutletEnthalpy()));
        assertTrue(Double.isNaN(heater.getOutletTemperature()));
        heater.setOutletTemperature(450);
        assertTrue(Double.isNaN(heater.getOutletQuality()));
        assertEquals(0, heater.equations(props).get(2).residual(), 1e-9);
    }

    @Test
    void testInvalidQuality() {
        heater.setOutletQuality(1.5);
        assertEquals("heater: outletQuality must be in [0, 1]: 1.5", heater.validate().get(0).toString());
        assertThrows(ConfigurationException.class, () -> heater.equations(props));
    }
}
