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
 * Steam separator with one inlet and a vapor and a liquid outlet.
 * <p>
 * Both outlets are at {@code p_in - dp}. Outlet enthalpies are pinned to target qualities standing for the
 * separation efficiency, and the mass and energy balances give the split of the inlet flow.
 */
public class Separator extends AbstractComponent {

    public static final String VAPOR = "vap";
    public static final String LIQUID = "liq";

    private double pressureDrop = 0;
    private double vaporQuality = 0.999;
    private double liquidQuality = 0.001;

    public Separator(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.SEPARATOR;
    }

    @Override
    protected List<String> getRequiredOutlets() {
        return List.of(VAPOR, LIQUID);
    }

    public double getPressureDrop() {
        return pressureDrop;
    }

    public Separator setPressureDrop(double pressureDrop) {
        this.pressureDrop = pressureDrop;
        return this;
    }

    public double getVaporQuality() {
        return vaporQuality;
    }

    public Separator setVaporQuality(double vaporQuality) {
        this.vaporQuality = vaporQuality;
        return this;
    }

    public double getLiquidQuality() {
        return liquidQuality;
    }

    public Separator setLiquidQuality(double liquidQuality) {
        this.liquidQuality = liquidQuality;
        return this;
    }

    private static void checkQuality(List<ConfigurationError> errors, String componentName, String parameter, double quality) {
        if (!(quality >= 0 && quality <= 1)) {
            errors.add(new ConfigurationError(componentName, parameter, "must be in [0, 1]: " + quality));
        }
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        checkQuality(errors, name, "vaporQuality", vaporQuality);
        checkQuality(errors, name, "liquidQuality", liquidQuality);
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection vap = requireOutlet(VAPOR);
        Connection liq = requireOutlet(LIQUID);

        double mIn = in.getM().getValue();
        double pOut = in.getP().getValue() - pressureDrop;
        double hVap = props.enthalpyPX(pOut, vaporQuality);
        double hLiq = props.enthalpyPX(pOut, liquidQuality);
        double energyIn = mIn * in.getH().getValue();
        double energyOut = vap.getM().getValue() * vap.getH().getValue() + liq.getM().getValue() * liq.getH().getValue();

        return List.of(
                Equation.pressure(name + ".p_vap", vap.getP().getValue() - pOut, pOut),
                Equation.pressure(name + ".p_liq", liq.getP().getValue() - pOut, pOut),
                Equation.enthalpy(name + ".h_vap_target", vap.getH().getValue() - hVap, hVap),
                Equation.enthalpy(name + ".h_liq_target", liq.getH().getValue() - hLiq, hLiq),
                Equation.mass(name + ".mass", mIn - (vap.getM().getValue() + liq.getM().getValue()), mIn),
                Equation.energy(name + ".energy", energyIn - energyOut, energyIn));
    }
}
