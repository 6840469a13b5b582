/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.network.AbstractComponent;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Boundary terminating an open branch. Each specified value pins the corresponding inlet variable.
 */
public class Sink extends AbstractComponent {

    private double pressure = Double.NaN;
    private double enthalpy = Double.NaN;

    public Sink(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.SINK;
    }

    @Override
    protected List<String> getRequiredOutlets() {
        return Collections.emptyList();
    }

    public double getPressure() {
        return pressure;
    }

    public Sink setPressure(double pressure) {
        this.pressure = pressure;
        return this;
    }

    public double getEnthalpy() {
        return enthalpy;
    }

    public Sink setEnthalpy(double enthalpy) {
        this.enthalpy = enthalpy;
        return this;
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        List<Equation> equations = new ArrayList<>(2);
        if (!Double.isNaN(pressure)) {
            equations.add(Equation.pressure(name + ".p_in", in.getP().getValue() - pressure, pressure));
        }
        if (!Double.isNaN(enthalpy)) {
            equations.add(Equation.enthalpy(name + ".h_in", in.getH().getValue() - enthalpy, enthalpy));
        }
        return equations;
    }
}
