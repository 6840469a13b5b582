/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.props;

import net.jafama.FastMath;

/**
 * Two-phase mixture rules shared by every backend.
 * <p>
 * Inside the saturation dome (0 &lt; x &lt; 1) the mixture is a homogeneous pseudo-fluid built from the
 * saturated liquid and vapor values: HEM density, void fraction from specific volumes, void fraction weighted
 * viscosity and conductivity, saturated liquid heat capacity and saturation temperature. Outside the dome the
 * single phase values of the backend are used.
 */
public abstract class AbstractFluidProperties implements FluidProperties {

    protected abstract double singlePhaseDensity(double p, double h);

    protected abstract double singlePhaseViscosity(double p, double h);

    protected abstract double singlePhaseConductivity(double p, double h);

    protected abstract double singlePhaseHeatCapacity(double p, double h);

    protected abstract double singlePhaseTemperature(double p, double h);

    protected abstract double singlePhaseEntropy(double p, double h);

    protected abstract double singlePhaseEnthalpyPS(double p, double s);

    private static boolean isTwoPhase(double x) {
        return x > 0 && x < 1;
    }

    private static double clipQuality(double x) {
        return FastMath.max(0.0, FastMath.min(1.0, x));
    }

    @Override
    public double qualityPH(double p, double h) {
        SaturationValues hSat = saturationEnthalpy(p);
        if (h <= hSat.liquid()) {
            return 0;
        }
        if (h >= hSat.vapor()) {
            return 1;
        }
        return clipQuality((h - hSat.liquid()) / hSat.difference());
    }

    @Override
    public double enthalpyPX(double p, double x) {
        double xc = clipQuality(x);
        SaturationValues hSat = saturationEnthalpy(p);
        return (1 - xc) * hSat.liquid() + xc * hSat.vapor();
    }

    @Override
    public double densityPX(double p, double x) {
        double xc = clipQuality(x);
        SaturationValues rhoSat = saturationDensity(p);
        return 1 / (xc / rhoSat.vapor() + (1 - xc) / rhoSat.liquid());
    }

    @Override
    public double densityPH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            return densityPX(p, x);
        }
        return singlePhaseDensity(p, h);
    }

    @Override
    public double voidFractionPH(double p, double h) {
        double x = qualityPH(p, h);
        if (x <= 0) {
            return 0;
        }
        if (x >= 1) {
            return 1;
        }
        SaturationValues rhoSat = saturationDensity(p);
        double vg = x / rhoSat.vapor();
        double vl = (1 - x) / rhoSat.liquid();
        return vg / (vg + vl);
    }

    @Override
    public double viscosityPH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            SaturationValues muSat = saturationViscosity(p);
            double alpha = voidFractionPH(p, h);
            return (1 - alpha) * muSat.liquid() + alpha * muSat.vapor();
        }
        return singlePhaseViscosity(p, h);
    }

    @Override
    public double conductivityPH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            SaturationValues kSat = saturationConductivity(p);
            double alpha = voidFractionPH(p, h);
            return (1 - alpha) * kSat.liquid() + alpha * kSat.vapor();
        }
        return singlePhaseConductivity(p, h);
    }

    @Override
    public double heatCapacityPH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            // cp is not defined inside the dome, correlations use the saturated liquid value
            return saturationHeatCapacity(p).liquid();
        }
        return singlePhaseHeatCapacity(p, h);
    }

    @Override
    public double temperaturePH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            return saturationTemperature(p);
        }
        return singlePhaseTemperature(p, h);
    }

    @Override
    public double entropyPH(double p, double h) {
        double x = qualityPH(p, h);
        if (isTwoPhase(x)) {
            SaturationValues sSat = saturationEntropy(p);
            return sSat.liquid() + x * sSat.difference();
        }
        return singlePhaseEntropy(p, h);
    }

    @Override
    public double enthalpyPS(double p, double s) {
        SaturationValues sSat = saturationEntropy(p);
        if (s > sSat.liquid() && s < sSat.vapor()) {
            return enthalpyPX(p, (s - sSat.liquid()) / sSat.difference());
        }
        return singlePhaseEnthalpyPS(p, s);
    }
}
