/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.correlations.PressureDrops;
import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.network.AbstractComponent;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;

import java.util.List;

/**
 * Sudden expansion or contraction: isenthalpic, with a form loss on the inlet velocity head, the acceleration
 * due to the area change and a gravity term at inlet density.
 */
public class AreaChange extends AbstractComponent {

    private double inletArea = 1.0;
    private double outletArea = 1.0;
    private double lossCoefficient = 0;
    private double elevation = 0;

    public AreaChange(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.AREA_CHANGE;
    }

    public double getInletArea() {
        return inletArea;
    }

    public AreaChange setInletArea(double inletArea) {
        this.inletArea = inletArea;
        return this;
    }

    public double getOutletArea() {
        return outletArea;
    }

    public AreaChange setOutletArea(double outletArea) {
        this.outletArea = outletArea;
        return this;
    }

    public double getLossCoefficient() {
        return lossCoefficient;
    }

    public AreaChange setLossCoefficient(double lossCoefficient) {
        this.lossCoefficient = lossCoefficient;
        return this;
    }

    public double getElevation() {
        return elevation;
    }

    public AreaChange setElevation(double elevation) {
        this.elevation = elevation;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        checkPositive(errors, name, "inletArea", inletArea);
        checkPositive(errors, name, "outletArea", outletArea);
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        double m = in.getM().getValue();
        double pIn = in.getP().getValue();
        double hIn = in.getH().getValue();
        double pOut = out.getP().getValue();
        double rhoIn = props.densityPH(pIn, hIn);
        double rhoOut = props.densityPH(pOut, out.getH().getValue());

        double dp = PressureDrops.formLoss(m, rhoIn, lossCoefficient, inletArea)
                + PressureDrops.areaChangeAcceleration(m, inletArea, outletArea, rhoIn, rhoOut)
                + PressureDrops.gravity(rhoIn, elevation);

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.enthalpy(name + ".h_isenthalpic", out.getH().getValue() - hIn, hIn),
                Equation.momentum(name + ".dp", pIn - pOut - dp, pIn));
    }
}
