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
 * Condenser closing the outlet state without any heat exchange model: the outlet pressure is fixed or equal to
 * {@code p_in - dp} and the outlet enthalpy is pinned to a target quality, saturated liquid by default, or to a
 * target temperature. The heat rejected is a result.
 */
public class Condenser extends AbstractComponent {

    private double pressureDrop = 0;
    private double outletPressure = Double.NaN;
    private double outletQuality = 0;
    private double outletTemperature = Double.NaN;

    public Condenser(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.CONDENSER;
    }

    public double getPressureDrop() {
        return pressureDrop;
    }

    public Condenser setPressureDrop(double pressureDrop) {
        this.pressureDrop = pressureDrop;
        return this;
    }

    public double getOutletPressure() {
        return outletPressure;
    }

    /**
     * Fix the outlet pressure, NaN to use the inlet pressure minus the pressure drop.
     */
    public Condenser setOutletPressure(double outletPressure) {
        this.outletPressure = outletPressure;
        return this;
    }

    public double getOutletQuality() {
        return outletQuality;
    }

    /**
     * Pin the outlet enthalpy to a quality, replacing any outlet temperature target.
     */
    public Condenser setOutletQuality(double outletQuality) {
        this.outletQuality = outletQuality;
        this.outletTemperature = Double.NaN;
        return this;
    }

    public double getOutletTemperature() {
        return outletTemperature;
    }

    /**
     * Pin the outlet enthalpy to a temperature [K] (subcooling), replacing the quality target.
     */
    public Condenser setOutletTemperature(double outletTemperature) {
        this.outletTemperature = outletTemperature;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        if (Double.isNaN(outletTemperature) && !(outletQuality >= 0 && outletQuality <= 1)) {
            errors.add(new ConfigurationError(name, "outletQuality", "must be in [0, 1]: " + outletQuality));
        }
    }

    /**
     * Heat removed from the fluid [W].
     */
    public double getHeatRejected() {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        return in.getM().getValue() * (in.getH().getValue() - out.getH().getValue());
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);

        double m = in.getM().getValue();
        double pOut = Double.isNaN(outletPressure) ? in.getP().getValue() - pressureDrop : outletPressure;
        double hOut = Double.isNaN(outletTemperature) ? props.enthalpyPX(pOut, outletQuality)
                                                      : props.enthalpyPT(pOut, outletTemperature);

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.pressure(name + ".p_out", out.getP().getValue() - pOut, pOut),
                Equation.enthalpy(name + ".h_out", out.getH().getValue() - hOut, hOut));
    }
}
