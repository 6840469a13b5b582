/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.props;

/**
 * Water/steam property evaluator consumed by the network components.
 * <p>
 * All values are in SI units: pressure [Pa], specific enthalpy [J/kg], specific entropy [J/kg/K],
 * temperature [K], density [kg/m3], dynamic viscosity [Pa.s], thermal conductivity [W/m/K],
 * specific heat [J/kg/K], surface tension [N/m]. Implementations must be free of side effects
 * visible to callers: two calls with the same arguments return the same value.
 */
public interface FluidProperties {

    // saturation line

    SaturationValues saturationEnthalpy(double p);

    SaturationValues saturationDensity(double p);

    SaturationValues saturationViscosity(double p);

    SaturationValues saturationConductivity(double p);

    SaturationValues saturationHeatCapacity(double p);

    SaturationValues saturationEntropy(double p);

    double saturationTemperature(double p);

    double surfaceTension(double p);

    // thermodynamic state

    double enthalpyPT(double p, double t);

    double temperaturePH(double p, double h);

    double entropyPH(double p, double h);

    double enthalpyPS(double p, double s);

    /**
     * Vapor mass fraction, clipped to [0, 1].
     */
    double qualityPH(double p, double h);

    double enthalpyPX(double p, double x);

    // transport and mixture

    double densityPH(double p, double h);

    double densityPX(double p, double x);

    double viscosityPH(double p, double h);

    double conductivityPH(double p, double h);

    double heatCapacityPH(double p, double h);

    /**
     * Vapor volume fraction under the homogeneous-equilibrium assumption.
     */
    double voidFractionPH(double p, double h);
}
