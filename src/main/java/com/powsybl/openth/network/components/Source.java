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
 * Boundary feeding an open branch. Each specified value pins the corresponding outlet variable.
 */
public class Source extends AbstractComponent {

    private double massFlow = Double.NaN;
    private double pressure = Double.NaN;
    private double enthalpy = Double.NaN;

    public Source(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.SOURCE;
    }

    @Override
    protected List<String> getRequiredInlets() {
        return Collections.emptyList();
    }

    public double getMassFlow() {
        return massFlow;
    }

    public Source setMassFlow(double massFlow) {
        this.massFlow = massFlow;
        return this;
    }

    public double getPressure() {
        return pressure;
    }

    public Source setPressure(double pressure) {
        this.pressure = pressure;
        return this;
    }

    public double getEnthalpy() {
        return enthalpy;
    }

    public Source setEnthalpy(double enthalpy) {
        this.enthalpy = enthalpy;
        return this;
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection out = requireOutlet(OUT);
        List<Equation> equations = new ArrayList<>(3);
        if (!Double.isNaN(massFlow)) {
            equations.add(Equation.mass(name + ".m_out", out.getM().getValue() - massFlow, massFlow));
        }
        if (!Double.isNaN(pressure)) {
            equations.add(Equation.pressure(name + ".p_out", out.getP().getValue() - pressure, pressure));
        }
        if (!Double.isNaN(enthalpy)) {
            equations.add(Equation.enthalpy(name + ".h_out", out.getH().getValue() - enthalpy, enthalpy));
        }
        return equations;
    }
}
