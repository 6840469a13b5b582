/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.correlations.PressureDropBreakdown;
import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.equations.EquationType;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.network.PortNotConnectedException;
import com.powsybl.openth.props.FluidProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.when;

/**
 * Balance equations and pressure drop breakdown of a pipe.
 */
class PipeTest {

    private FluidProperties props;

    private Connection in;

    private Connection out;

    private Pipe pipe;

    @BeforeEach
    void setUp() {
        props = Mockito.mock(FluidProperties.class);
        when(props.densityPH(anyDouble(), anyDouble())).thenReturn(1000.0);
        when(props.viscosityPH(anyDouble(), anyDouble())).thenReturn(1e-3);
        in = Connection.create("in", 10, 2e5, 4e5);
        out = Connection.create("out", 10, 2e5, 4e5);
        pipe = new Pipe("pipe");
        pipe.connectInlet(Pipe.IN, in);
        pipe.connectOutlet(Pipe.OUT, out);
    }

    @Test
    void testDefaults() {
        Pipe p = new Pipe("p");
        assertEquals(ComponentType.PIPE, p.getType());
        assertEquals(1, p.getLength());
        assertEquals(0.1, p.getDiameter());
        assertEquals(Math.PI * 0.01 / 4, p.getArea(), 1e-15);
        assertEquals(0, p.getHeat());
        assertTrue(p.isAccelerationIncluded());
        assertEquals("PIPE(p)", p.toString());
        p.setArea(0.5);
        assertEquals(0.5, p.getArea());
    }

    @Test
    void testPortNotConnected() {
        Pipe p = new Pipe("p");
        PortNotConnectedException e = assertThrows(PortNotConnectedException.class, () -> p.equations(props));
        assertEquals("p", e.getComponentName());
        assertEquals("in", e.getPort());
        assertEquals("p: inlet 'in' is not connected", e.getMessage());

        p.connectInlet(Pipe.IN, in);
        e = assertThrows(PortNotConnectedException.class, () -> p.equations(props));
        assertEquals("out", e.getPort());
    }

    @Test
    void testEquations() {
        List<Equation> equations = pipe.equations(props);
        assertEquals(List.of("pipe.mass", "pipe.energy", "pipe.dp"), equations.stream().map(Equation::name).toList());
        assertEquals(List.of(EquationType.MASS, EquationType.ENTHALPY, EquationType.MOMENTUM), equations.stream().map(Equation::type).toList());
        assertEquals(0, equations.get(0).residual());
        assertEquals(0, equations.get(1).residual());
        // no pressure drop yet on the outlet
        PressureDropBreakdown dp = pipe.getPressureDrop(props);
        assertTrue(dp.friction() > 0);
        assertEquals(-dp.total(), equations.get(2).residual(), 1e-9);

        out.getP().setValue(2e5 - dp.total());
        out.getM().setValue(12);
        equations = pipe.equations(props);
        assertEquals(2, equations.get(0).residual(), 1e-12);
        assertEquals(0, equations.get(2).residual(), 1e-6);
    }

    @Test
    void testHeat() {
        pipe.setHeat(1e6);
        Equation energy = pipe.equations(props).get(1);
        assertEquals(-1e5, energy.residual(), 1e-9);
        assertEquals(5e5, energy.scale(), 1e-9);
    }

    @Test
    void testEnthalpyRiseAtZeroFlow() {
        assertEquals(0, Pipe.enthalpyRise(1e6, 0));
        assertEquals(1e5, Pipe.enthalpyRise(1e6, 10));
    }

    @Test
    void testElevation() {
        pipe.setElevation(-10).setLossCoefficient(0).setLength(1e-3);
        // going down raises the pressure
        assertTrue(pipe.getPressureDrop(props).total() < 0);
        assertEquals(-1000 * 9.80665 * 10, pipe.getPressureDrop(props).gravity(), 1e-9);
    }

    @Test
    void testValidation() {
        pipe.setDiameter(0).setLength(-1);
        List<ConfigurationError> errors = pipe.validate();
        assertEquals(3, errors.size());
        assertEquals("pipe", errors.get(0).elementName());
        assertEquals("diameter", errors.get(0).subject());
        assertEquals("area", errors.get(1).subject());
        assertEquals("length", errors.get(2).subject());
    }
}
