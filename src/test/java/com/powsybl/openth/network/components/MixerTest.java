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
import com.powsybl.openth.network.PortNotConnectedException;
import com.powsybl.openth.props.FluidProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pressure equality, mass and energy balance of a mixer with any number of inlets.
 */
class MixerTest {

    private FluidProperties props;

    private Mixer mixer;

    @BeforeEach
    void setUp() {
        props = Mockito.mock(FluidProperties.class);
        mixer = new Mixer("mixer");
    }

    @Test
    void testTooFewInlets() {
        mixer.connectOutlet(Mixer.OUT, Connection.create("out", 10, 1e6, 1e6));
        mixer.connectInlet("a", Connection.create("a", 10, 1e6, 1e6));
        assertEquals("mixer: inlets must be at least 2, found 1", mixer.validate().get(0).toString());
        assertThrows(ConfigurationException.class, () -> mixer.equations(props));
    }

    @Test
    void testMissingOutlet() {
        mixer.connectInlet("a", Connection.create("a", 10, 1e6, 1e6));
        mixer.connectInlet("b", Connection.create("b", 10, 1e6, 1e6));
        PortNotConnectedException e = assertThrows(PortNotConnectedException.class, () -> mixer.equations(props));
        assertEquals("out", e.getPort());
    }

    @Test
    void testBalances() {
        mixer.connectInlet("liquid", Connection.create("a", 10, 1e6, 1e6));
        mixer.connectInlet("feed", Connection.create("b", 30, 1.1e6, 2e6));
        Connection out = Connection.create("out", 40, 1e6, 1.75e6);
        mixer.connectOutlet(Mixer.OUT, out);
        assertTrue(mixer.validate().isEmpty());

        List<Equation> equations = mixer.equations(props);
        assertEquals(List.of("mixer.p_eq_liquid", "mixer.p_eq_feed", "mixer.mass", "mixer.energy"),
                     equations.stream().map(Equation::name).toList());
        assertEquals(0, equations.get(0).residual());
        assertEquals(-1e5, equations.get(1).residual(), 1e-9);
        assertEquals(0, equations.get(2).residual(), 1e-12);
        assertEquals(0, equations.get(3).residual(), 1e-6);

        out.getH().setValue(1.8e6);
        assertEquals(40 * 0.05e6, mixer.equations(props).get(3).residual(), 1e-3);
    }
}
