/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

import net.jafama.FastMath;

/**
 * Convective heat transfer correlations, used for post-processing only: no component equation depends on them.
 */
public final class HeatTransfer {

    public static final double DITTUS_BOELTER_HEATING_EXPONENT = 0.4;
    public static final double DITTUS_BOELTER_COOLING_EXPONENT = 0.3;

    private static final double LAMINAR_NUSSELT = 3.66;

    private HeatTransfer() {
    }

    /**
     * Single-phase internal convection heat transfer coefficient [W/m2/K] from the Dittus-Boelter correlation
     * Nu = 0.023 Re^0.8 Pr^n. Below Re = 2300 the fully developed laminar value Nu = 3.66 is used.
     * Roughly valid for Re &gt; 1e4, 0.7 &lt; Pr &lt; 160 and L/D &gt; 10.
     *
     * @param massFlux mass flux [kg/m2/s]
     * @param diameter hydraulic diameter [m]
     * @param viscosity dynamic viscosity [Pa.s]
     * @param heatCapacity specific heat [J/kg/K]
     * @param conductivity thermal conductivity [W/m/K]
     * @param exponent Prandtl exponent, 0.4 when the fluid is heated, 0.3 when cooled
     * @return heat transfer coefficient, 0 for invalid inputs
     */
    public static double dittusBoelter(double massFlux, double diameter, double viscosity, double heatCapacity,
                                       double conductivity, double exponent) {
        if (diameter <= 0 || viscosity <= 0 || conductivity <= 0 || heatCapacity <= 0) {
            return 0;
        }
        double re = FastMath.abs(massFlux * diameter / viscosity);
        double pr = heatCapacity * viscosity / conductivity;
        double nu;
        if (re < FrictionFactors.LAMINAR_REYNOLDS_LIMIT) {
            nu = LAMINAR_NUSSELT;
        } else {
            nu = 0.023 * FastMath.pow(re, 0.8) * FastMath.pow(pr, exponent);
        }
        return nu * conductivity / diameter;
    }

    public static double dittusBoelter(double massFlux, double diameter, double viscosity, double heatCapacity,
                                       double conductivity) {
        return dittusBoelter(massFlux, diameter, viscosity, heatCapacity, conductivity, DITTUS_BOELTER_HEATING_EXPONENT);
    }
}
