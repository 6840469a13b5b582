/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

import com.powsybl.openth.props.FluidProperties;
import com.powsybl.openth.props.SaturationValues;
import net.jafama.FastMath;

import java.util.Objects;

/**
 * Pressure drop decomposition of lumped flow elements.
 * <p>
 * Friction, form and gravity terms are evaluated at the mid state, the average of inlet and outlet pressure and
 * enthalpy. Terms whose inputs are not physical (zero area, zero density...) are 0.
 */
public final class PressureDrops {

    public static final double GRAVITY = 9.80665;

    private static final double MIN_VISCOSITY = 1e-12;
    private static final double MIN_DENSITY = 1e-12;
    private static final double CHISHOLM_REYNOLDS_LIMIT = 2000;
    private static final double MIN_QUALITY = 1e-8;

    private PressureDrops() {
    }

    /**
     * Pressure drop breakdown of a pipe-like element with equal inlet and outlet areas.
     *
     * @param props fluid properties
     * @param massFlow mass flow [kg/s]
     * @param pIn inlet pressure [Pa]
     * @param hIn inlet specific enthalpy [J/kg]
     * @param pOut outlet pressure [Pa]
     * @param hOut outlet specific enthalpy [J/kg]
     * @param parameters element geometry and losses
     */
    public static PressureDropBreakdown pipe(FluidProperties props, double massFlow, double pIn, double hIn,
                                             double pOut, double hOut, HydraulicParameters parameters) {
        Objects.requireNonNull(props);
        Objects.requireNonNull(parameters);
        double pAvg = 0.5 * (pIn + pOut);
        double hAvg = 0.5 * (hIn + hOut);
        double rhoAvg = props.densityPH(pAvg, hAvg);

        double friction = switch (parameters.frictionModel()) {
            case HOMOGENEOUS -> homogeneousFriction(massFlow, rhoAvg, props.viscosityPH(pAvg, hAvg), parameters);
            case CHISHOLM -> chisholmFriction(props, massFlow, pAvg, hAvg, parameters);
        };
        double form = formLoss(massFlow, rhoAvg, parameters.lossCoefficient(), parameters.area());
        double gravity = gravity(rhoAvg, parameters.elevation());
        double acceleration = 0;
        if (parameters.accelerationIncluded()) {
            acceleration = acceleration(massFlow, parameters.area(), props.densityPH(pIn, hIn), props.densityPH(pOut, hOut));
        }
        return new PressureDropBreakdown(friction, form, gravity, acceleration);
    }

    /**
     * K G^2 / (2 rho).
     */
    public static double formLoss(double massFlow, double density, double lossCoefficient, double area) {
        if (area <= 0 || density <= 0) {
            return 0;
        }
        double g = massFlow / area;
        return lossCoefficient * g * g / (2 * density);
    }

    public static double gravity(double density, double elevation) {
        return density * GRAVITY * elevation;
    }

    /**
     * G^2 (1/rho_out - 1/rho_in) for a constant area.
     */
    public static double acceleration(double massFlow, double area, double densityIn, double densityOut) {
        if (area <= 0 || densityIn <= 0 || densityOut <= 0) {
            return 0;
        }
        double g = massFlow / area;
        return g * g * (1 / densityOut - 1 / densityIn);
    }

    /**
     * m^2 (1/(rho_out A_out^2) - 1/(rho_in A_in^2)) for an area change.
     */
    public static double areaChangeAcceleration(double massFlow, double areaIn, double areaOut, double densityIn,
                                                double densityOut) {
        if (areaIn <= 0 || areaOut <= 0 || densityIn <= 0 || densityOut <= 0) {
            return 0;
        }
        return massFlow * massFlow * (1 / (densityOut * areaOut * areaOut) - 1 / (densityIn * areaIn * areaIn));
    }

    private static boolean isValidGeometry(HydraulicParameters parameters) {
        return parameters.area() > 0 && parameters.diameter() > 0 && parameters.length() > 0;
    }

    /**
     * f (L/D) G^2 / (2 rho) with friction factor from the Reynolds number G D / mu.
     */
    private static double darcyWeisbach(double massFlux, double density, double viscosity, HydraulicParameters parameters) {
        double d = parameters.diameter();
        double re = FastMath.abs(massFlux * d / viscosity);
        double f = FrictionFactors.haaland(re, parameters.roughness() / d);
        return f * (parameters.length() / d) * massFlux * massFlux / (2 * density);
    }

    static double homogeneousFriction(double massFlow, double density, double viscosity, HydraulicParameters parameters) {
        if (!isValidGeometry(parameters) || density <= 0 || viscosity <= 0) {
            return 0;
        }
        return darcyWeisbach(massFlow / parameters.area(), density, viscosity, parameters);
    }

    static double chisholmFriction(FluidProperties props, double massFlow, double p, double h, HydraulicParameters parameters) {
        if (!isValidGeometry(parameters)) {
            return 0;
        }
        double x = props.qualityPH(p, h);
        SaturationValues rho = props.saturationDensity(p);
        SaturationValues mu = props.saturationViscosity(p);

        double g = massFlow / parameters.area();
        double d = parameters.diameter();
        double muL = FastMath.max(mu.liquid(), MIN_VISCOSITY);
        double muV = FastMath.max(mu.vapor(), MIN_VISCOSITY);
        double reL = FastMath.abs(g * d / muL);
        double reV = FastMath.abs(g * d / muV);

        double dpLiquidOnly = darcyWeisbach(g, FastMath.max(rho.liquid(), MIN_DENSITY), muL, parameters);
        if (x <= 0) {
            return dpLiquidOnly;
        }
        if (x >= 1) {
            return darcyWeisbach(g, FastMath.max(rho.vapor(), MIN_DENSITY), muV, parameters);
        }
        return chisholmMultiplier(x, rho, mu, reL, reV) * dpLiquidOnly;
    }

    /**
     * Chisholm liquid two-phase multiplier 1 + C/X + 1/X^2, with X the Lockhart-Martinelli parameter.
     */
    static double chisholmMultiplier(double quality, SaturationValues density, SaturationValues viscosity,
                                     double liquidOnlyReynolds, double vaporOnlyReynolds) {
        if (density.liquid() <= 0 || density.vapor() <= 0 || viscosity.liquid() <= 0 || viscosity.vapor() <= 0) {
            return 1;
        }
        double x = FastMath.min(FastMath.max(quality, MIN_QUALITY), 1 - MIN_QUALITY);
        double xtt = FastMath.pow((1 - x) / x, 0.9)
                * FastMath.sqrt(density.vapor() / density.liquid())
                * FastMath.pow(viscosity.liquid() / viscosity.vapor(), 0.1);
        double c = chisholmConstant(liquidOnlyReynolds, vaporOnlyReynolds);
        return 1 + c / xtt + 1 / (xtt * xtt);
    }

    static double chisholmConstant(double liquidOnlyReynolds, double vaporOnlyReynolds) {
        boolean liquidLaminar = liquidOnlyReynolds < CHISHOLM_REYNOLDS_LIMIT;
        boolean vaporLaminar = vaporOnlyReynolds < CHISHOLM_REYNOLDS_LIMIT;
        if (!liquidLaminar && !vaporLaminar) {
            return 20;
        }
        if (liquidLaminar && vaporLaminar) {
            return 5;
        }
        return 12;
    }
}
