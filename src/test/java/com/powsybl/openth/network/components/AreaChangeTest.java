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
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.when;

/**
 * Momentum balance of a sudden expansion.
 */
class AreaChangeTest {

    @Test
    void testSuddenExpansion() {
        FluidProperties props = Mockito.mock(FluidProperties.class);
        when(props.densityPH(anyDouble(), anyDouble())).thenReturn(1000.0);
        Connection out = Connection.create("out", 10, 1e6, 5e5);
        AreaChange expansion = new AreaChange("expansion")
                .setInletArea(0.1)
                .setOutletArea(0.2)
                .setLossCoefficient(0.5625);
        expansion.connectInlet(AreaChange.IN, Connection.create("in", 10, 1e6, 5e5));
        expansion.connectOutlet(AreaChange.OUT, out);

        // form loss 0.5625 * 100^2 / 2000 = 2.8125, acceleration -7.5
        List<Equation> equations = expansion.equations(props);
        assertEquals(List.of("expansion.mass", "expansion.h_isenthalpic", "expansion.dp"), equations.stream().map(Equation::name).toList());
        assertEquals(-(2.8125 - 7.5), equations.get(2).residual(), 1e-9);

        expansion.setOutletArea(0);
        assertEquals(1, expansion.validate().size());
    }
}
