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
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;

import java.util.List;

/**
 * Steam turbine with a constant isentropic efficiency:
 * {@code h_out = h_in - eta (h_in - h_is(p_out, s_in))}.
 * The outlet pressure is given either directly or as a ratio of the inlet pressure.
 */
public class Turbine extends AbstractComponent {

    private double efficiency = 0.85;
    private double outletPressure = Double.NaN;
    private double pressureRatio = Double.NaN;

    public Turbine(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.TURBINE;
    }

    public double getEfficiency() {
        return efficiency;
    }

    public Turbine setEfficiency(double efficiency) {
        this.efficiency = efficiency;
        return this;
    }

    public double getOutletPressure() {
        return outletPressure;
    }

    public Turbine setOutletPressure(double outletPressure) {
        this.outletPressure = outletPressure;
        return this;
    }

    public double getPressureRatio() {
        return pressureRatio;
    }

    public Turbine setPressureRatio(double pressureRatio) {
        this.pressureRatio = pressureRatio;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        if (!(efficiency > 0 && efficiency <= 1)) {
            errors.add(new ConfigurationError(name, "efficiency", "must be in ]0, 1]: " + efficiency));
        }
        boolean outletPressureSet = !Double.isNaN(outletPressure);
        boolean pressureRatioSet = !Double.isNaN(pressureRatio);
        if (outletPressureSet == pressureRatioSet) {
            errors.add(new ConfigurationError(name, "outletPressure", "or pressureRatio must be specified, but not both"));
        }
    }

    /**
     * Shaft power delivered by the fluid [W].
     */
    public double getShaftPower() {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        return in.getM().getValue() * (in.getH().getValue() - out.getH().getValue());
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        checkParameters();

        double m = in.getM().getValue();
        double pIn = in.getP().getValue();
        double hIn = in.getH().getValue();
        double pOut = Double.isNaN(outletPressure) ? pressureRatio * pIn : outletPressure;
        double sIn = props.entropyPH(pIn, hIn);
        double hIsentropic = props.enthalpyPS(pOut, sIn);
        double hOut = hIn - efficiency * (hIn - hIsentropic);

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.pressure(name + ".p_out", out.getP().getValue() - pOut, pOut),
                Equation.enthalpy(name + ".energy", out.getH().getValue() - hOut, hOut));
    }
}
