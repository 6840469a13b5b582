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
 * Feedwater heater without any heat exchange model: the outlet pressure is fixed or equal to {@code p_in - dp} and
 * the outlet enthalpy is pinned to a target temperature, a target quality or a target enthalpy. The heat added is a
 * result.
 */
public class Heater extends AbstractComponent {

    private double pressureDrop = 0;
    private double outletPressure = Double.NaN;
    private double outletTemperature = Double.NaN;
    private double outletQuality = Double.NaN;
    private double outletEnthalpy = Double.NaN;

    public Heater(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.HEATER;
    }

    public double getPressureDrop() {
        return pressureDrop;
    }

    public Heater setPressureDrop(double pressureDrop) {
        this.pressureDrop = pressureDrop;
        return this;
    }

    public double getOutletPressure() {
        return outletPressure;
    }

    /**
     * Fix the outlet pressure, NaN to use the inlet pressure minus the pressure drop.
     */
    public Heater setOutletPressure(double outletPressure) {
        this.outletPressure = outletPressure;
        return this;
    }

    public double getOutletTemperature() {
        return outletTemperature;
    }

    /**
     * Target outlet temperature [K], replacing any outlet quality or enthalpy target.
     */
    public Heater setOutletTemperature(double outletTemperature) {
        this.outletTemperature = outletTemperature;
        this.outletQuality = Double.NaN;
        this.outletEnthalpy = Double.NaN;
        return this;
    }

    public double getOutletQuality() {
        return outletQuality;
    }

    /**
     * Target outlet quality, replacing any outlet temperature or enthalpy target.
     */
    public Heater setOutletQuality(double outletQuality) {
        this.outletQuality = outletQuality;
        this.outletTemperature = Double.NaN;
        this.outletEnthalpy = Double.NaN;
        return this;
    }

    public double getOutletEnthalpy() {
        return outletEnthalpy;
    }

    /**
     * Target outlet enthalpy [J/kg], replacing any outlet temperature or quality target.
     */
    public Heater setOutletEnthalpy(double outletEnthalpy) {
        this.outletEnthalpy = outletEnthalpy;
        this.outletTemperature = Double.NaN;
        this.outletQuality = Double.NaN;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        if (Double.isNaN(outletTemperature) && Double.isNaN(outletQuality) && Double.isNaN(outletEnthalpy)) {
            errors.add(new ConfigurationError(name, "outletTemperature", "or outletQuality or outletEnthalpy must be specified"));
        } else if (!Double.isNaN(outletQuality) && (outletQuality < 0 || outletQuality > 1)) {
            errors.add(new ConfigurationError(name, "outletQuality", "must be in [0, 1]: " + outletQuality));
        }
    }

    /**
     * Heat given to the fluid [W].
     */
    public double getHeatAdded() {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        return in.getM().getValue() * (out.getH().getValue() - in.getH().getValue());
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        checkParameters();

        double m = in.getM().getValue();
        double pOut = Double.isNaN(outletPressure) ? in.getP().getValue() - pressureDrop : outletPressure;
        double hOut;
        if (!Double.isNaN(outletEnthalpy)) {
            hOut = outletEnthalpy;
        } else if (!Double.isNaN(outletQuality)) {
            hOut = props.enthalpyPX(pOut, outletQuality);
        } else {
            hOut = props.enthalpyPT(pOut, outletTemperature);
        }

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.pressure(name + ".p_out", out.getP().getValue() - pOut, pOut),
                Equation.enthalpy(name + ".h_out", out.getH().getValue() - hOut, hOut));
    }
}
