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
 * Isenthalpic throttling element. The irreversible pressure drop comes from exactly one of:
 * <ul>
 *     <li>a loss coefficient K and a flow area: {@code dp = K G^2 / (2 rho)},</li>
 *     <li>a discharge coefficient Cd and a flow area: {@code dp = (m / (Cd A))^2 / (2 rho)}.</li>
 * </ul>
 * Densities are taken at the inlet. Flashing follows from the isenthalpic drop when saturation is crossed.
 */
public class OrificePlate extends AbstractComponent {

    private double lossCoefficient = Double.NaN;
    private double dischargeCoefficient = Double.NaN;
    private double area = Double.NaN;
    private double elevation = 0;

    public OrificePlate(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.ORIFICE_PLATE;
    }

    public double getLossCoefficient() {
        return lossCoefficient;
    }

    public OrificePlate setLossCoefficient(double lossCoefficient) {
        this.lossCoefficient = lossCoefficient;
        return this;
    }

    public double getDischargeCoefficient() {
        return dischargeCoefficient;
    }

    public OrificePlate setDischargeCoefficient(double dischargeCoefficient) {
        this.dischargeCoefficient = dischargeCoefficient;
        return this;
    }

    public double getArea() {
        return area;
    }

    public OrificePlate setArea(double area) {
        this.area = area;
        return this;
    }

    public double getElevation() {
        return elevation;
    }

    public OrificePlate setElevation(double elevation) {
        this.elevation = elevation;
        return this;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        boolean lossModel = !Double.isNaN(lossCoefficient);
        boolean dischargeModel = !Double.isNaN(dischargeCoefficient);
        if (lossModel && dischargeModel) {
            errors.add(new ConfigurationError(name, "lossCoefficient", "and dischargeCoefficient cannot be both specified"));
        } else if (!lossModel && !dischargeModel) {
            errors.add(new ConfigurationError(name, "lossCoefficient", "or dischargeCoefficient must be specified"));
        }
        if (Double.isNaN(area)) {
            errors.add(new ConfigurationError(name, "area", "must be specified"));
        } else {
            checkPositive(errors, name, "area", area);
        }
        if (dischargeModel) {
            checkPositive(errors, name, "dischargeCoefficient", dischargeCoefficient);
        }
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        checkParameters();

        double m = in.getM().getValue();
        double pIn = in.getP().getValue();
        double hIn = in.getH().getValue();
        double rho = props.densityPH(pIn, hIn);

        double dp;
        if (!Double.isNaN(lossCoefficient)) {
            dp = PressureDrops.formLoss(m, rho, lossCoefficient, area);
        } else {
            double v = m / (rho * area);
            dp = v * v * rho / (2 * dischargeCoefficient * dischargeCoefficient);
        }
        dp += PressureDrops.gravity(rho, elevation);

        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.enthalpy(name + ".h_isenthalpic", out.getH().getValue() - hIn, hIn),
                Equation.momentum(name + ".dp", pIn - out.getP().getValue() - dp, pIn));
    }
}
