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
import net.jafama.FastMath;

import java.util.List;

/**
 * Liquid pump with a constant efficiency: {@code h_out = h_in + (p_out - p_in) / (rho_in eta)}.
 * The outlet pressure is given either directly or as a rise over the inlet pressure.
 */
public class Pump extends AbstractComponent {

    private static final double MIN_DENOMINATOR = 1e-9;

    private double efficiency = 0.8;
    private double outletPressure = Double.NaN;
    private double pressureRise = Double.NaN;

    public Pump(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.PUMP;
    }

    public double getEfficiency() {
        return efficiency;
    }

    public Pump setEfficiency(double efficiency) {
        this.efficiency = efficiency;
        return this;
    }

    public double getOutletPressure() {
        return outletPressure;
    }

    public Pump setOutletPressure(double outletPressure) {
        this.outletPressure = outletPressure;
        return this;
    }

    public double getPressureRise() {
        return pressureRise;
    }

    public Pump setPressureRise(double pressureRise) {
        this.pressureRise = pressureRise;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        if (!(efficiency > 0 && efficiency <= 1)) {
            errors.add(new ConfigurationError(name, "efficiency", "must be in ]0, 1]: " + efficiency));
        }
        boolean outletPressureSet = !Double.isNaN(outletPressure);
        boolean pressureRiseSet = !Double.isNaN(pressureRise);
        if (outletPressureSet == pressureRiseSet) {
            errors.add(new ConfigurationError(name, "outletPressure", "or pressureRise must be specified, but not both"));
        }
    }

    /**
     * Shaft power given to the fluid [W].
     */
    public double getShaftPower() {
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
        double pIn = in.getP().getValue();
        double hIn = in.getH().getValue();
        double pOut = Double.isNaN(outletPressure) ? pIn + pressureRise : outletPressure;
        double rhoIn = props.densityPH(pIn, hIn);
        double hOut = hIn + (pOut - pIn) / FastMath.max(MIN_DENOMINATOR, rhoIn * efficiency);

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.pressure(name + ".p_out", out.getP().getValue() - pOut, pOut),
                Equation.enthalpy(name + ".energy", out.getH().getValue() - hOut, hOut));
    }
}
