/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.props;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import net.jafama.FastMath;

/**
 * Water/steam properties interpolated in a saturation table, from 1 kPa to 15 MPa.
 * <p>
 * Saturation values are natural cubic splines in ln(p). Compressed liquid is approximated by the saturated
 * liquid having the same enthalpy (same temperature for {@link #enthalpyPT}, same entropy for
 * {@link #enthalpyPS}), shifted to be continuous with the saturation line at the actual pressure. Superheated
 * vapor is a constant cp, ideal gas extension of the saturated vapor. Pressures outside of the table are clamped.
 * Accuracy is about one percent against IAPWS-IF97 in the range covered, which is enough for network studies;
 * an IAPWS-IF97 backend can replace this one behind {@link FluidProperties}.
 * <p>
 * Single phase states are memoized in a bounded cache keyed by the inputs rounded to 0.01 Pa and 0.001 J/kg.
 * Inputs are rounded whether or not the cache hits, so the cache has no observable effect on results.
 */
public class TabulatedWaterProperties extends AbstractFluidProperties {

    public static final long DEFAULT_CACHE_SIZE = 8192;

    private static final double KELVIN = 273.15;

    private static final double PRESSURE_ROUNDING = 100; // 0.01 Pa
    private static final double ENTHALPY_ROUNDING = 1000; // 0.001 J/kg

    // pressure [MPa]
    private static final double[] P = {
        0.001, 0.002, 0.005, 0.01, 0.02, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0, 12.0, 15.0
    };
    // saturation temperature [C]
    private static final double[] T_SAT = {
        6.97, 17.50, 32.87, 45.81, 60.06, 81.32, 99.61, 120.21, 151.83, 179.88, 212.38, 233.85, 250.35, 263.94, 275.59,
        285.83, 295.01, 303.35, 311.00, 324.68, 342.16
    };
    // specific volume [m3/kg]
    private static final double[] V_F = {
        0.001000, 0.001001, 0.001005, 0.001010, 0.001017, 0.001030, 0.001043, 0.001061, 0.001093, 0.001127, 0.001177,
        0.001217, 0.001252, 0.001286, 0.001319, 0.001352, 0.001385, 0.001418, 0.001453, 0.001527, 0.001657
    };
    private static final double[] V_G = {
        129.19, 66.990, 28.185, 14.670, 7.6481, 3.2403, 1.6941, 0.88578, 0.37483, 0.19436, 0.09959, 0.066664, 0.049779,
        0.039448, 0.032449, 0.027378, 0.023525, 0.020489, 0.018028, 0.014264, 0.010341
    };
    // specific enthalpy [kJ/kg]
    private static final double[] H_F = {
        29.30, 73.43, 137.75, 191.81, 251.42, 340.54, 417.51, 504.70, 640.09, 762.51, 908.47, 1008.3, 1087.4, 1154.5,
        1213.8, 1267.5, 1317.1, 1363.7, 1408.1, 1491.5, 1610.3
    };
    private static final double[] H_G = {
        2513.7, 2532.9, 2560.7, 2583.9, 2608.9, 2645.2, 2675.0, 2706.3, 2748.1, 2777.1, 2798.3, 2803.2, 2800.8, 2794.2,
        2784.6, 2772.6, 2758.7, 2742.9, 2725.5, 2685.4, 2610.7
    };
    // specific entropy [kJ/kg/K]
    private static final double[] S_F = {
        0.1059, 0.2606, 0.4762, 0.6492, 0.8320, 1.0912, 1.3028, 1.5302, 1.8604, 2.1381, 2.4467, 2.6454, 2.7966, 2.9207,
        3.0275, 3.1220, 3.2077, 3.2866, 3.3603, 3.4964, 3.6848
    };
    private static final double[] S_G = {
        8.9749, 8.7227, 8.3938, 8.1488, 7.9073, 7.5930, 7.3589, 7.1270, 6.8207, 6.5850, 6.3390, 6.1856, 6.0696, 5.9737,
        5.8902, 5.8148, 5.7450, 5.6791, 5.6159, 5.4939, 5.3108
    };
    // dynamic viscosity [1e-6 Pa.s]
    private static final double[] MU_F = {
        1428, 1069, 752, 588, 466, 347, 282, 232, 180, 150, 127, 115, 106, 100, 95.0, 91.0, 87.4, 84.2, 81.3, 75.9, 68.6
    };
    private static final double[] MU_G = {
        9.1, 9.5, 10.0, 10.4, 10.8, 11.5, 12.2, 13.0, 14.2, 15.2, 16.3, 17.1, 17.7, 18.3, 18.8, 19.3, 19.8, 20.3, 20.8,
        21.8, 23.5
    };
    // thermal conductivity [W/m/K]
    private static final double[] K_F = {
        0.571, 0.592, 0.619, 0.637, 0.654, 0.670, 0.679, 0.683, 0.682, 0.673, 0.655, 0.636, 0.618, 0.603, 0.588, 0.574,
        0.561, 0.548, 0.535, 0.511, 0.474
    };
    private static final double[] K_G = {
        0.0176, 0.0182, 0.0192, 0.0200, 0.0209, 0.0224, 0.0251, 0.0272, 0.0318, 0.0370, 0.0444, 0.0502, 0.0555, 0.0607,
        0.0659, 0.0712, 0.0766, 0.0822, 0.0881, 0.1012, 0.1254
    };
    // specific heat [kJ/kg/K]
    private static final double[] CP_F = {
        4.200, 4.184, 4.179, 4.180, 4.184, 4.197, 4.216, 4.245, 4.311, 4.405, 4.578, 4.732, 4.872, 5.045, 5.228, 5.414,
        5.626, 5.856, 6.124, 6.80, 8.76
    };
    private static final double[] CP_G = {
        1.87, 1.87, 1.88, 1.89, 1.92, 1.97, 2.08, 2.18, 2.42, 2.71, 3.18, 3.60, 4.00, 4.40, 4.82, 5.24, 5.70, 6.19, 6.75,
        8.15, 11.5
    };
    // surface tension [1e-3 N/m]
    private static final double[] SIGMA = {
        74.3, 72.9, 70.5, 68.6, 66.2, 62.5, 58.9, 54.9, 48.6, 42.2, 35.0, 30.1, 26.2, 23.1, 20.4, 18.0, 15.9, 14.1, 12.4,
        9.5, 5.8
    };

    private record StateKey(long p, long h) {
    }

    private record State(double temperature, double density, double viscosity, double conductivity,
                         double heatCapacity, double entropy) {
    }

    private final double minPressure;
    private final double maxPressure;

    // saturation line, functions of ln(p)
    private final TabulatedFunction tSat;
    private final TabulatedFunction hF;
    private final TabulatedFunction hG;
    private final TabulatedFunction rhoF;
    private final TabulatedFunction lnRhoG;
    private final TabulatedFunction sF;
    private final TabulatedFunction sG;
    private final TabulatedFunction muF;
    private final TabulatedFunction muG;
    private final TabulatedFunction kF;
    private final TabulatedFunction kG;
    private final TabulatedFunction cpF;
    private final TabulatedFunction cpG;
    private final TabulatedFunction sigma;

    // compressed liquid, functions of the saturated liquid enthalpy
    private final TabulatedFunction liquidTemperatureByH;
    private final TabulatedFunction liquidDensityByH;
    private final TabulatedFunction liquidEntropyByH;
    private final TabulatedFunction liquidViscosityByH;
    private final TabulatedFunction liquidConductivityByH;
    private final TabulatedFunction liquidHeatCapacityByH;

    // compressed liquid enthalpy as a function of temperature and of entropy
    private final TabulatedFunction liquidEnthalpyByT;
    private final TabulatedFunction liquidEnthalpyByS;

    private final Cache<StateKey, State> cache;

    public TabulatedWaterProperties() {
        this(DEFAULT_CACHE_SIZE);
    }

    public TabulatedWaterProperties(long cacheSize) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("Invalid cache size: " + cacheSize);
        }
        int n = P.length;
        double[] lnP = new double[n];
        double[] t = new double[n];
        double[] hf = new double[n];
        double[] hg = new double[n];
        double[] rhof = new double[n];
        double[] lnRhog = new double[n];
        double[] sf = new double[n];
        double[] sg = new double[n];
        double[] muf = new double[n];
        double[] mug = new double[n];
        double[] cpf = new double[n];
        double[] cpg = new double[n];
        double[] sig = new double[n];
        for (int i = 0; i < n; i++) {
            lnP[i] = FastMath.log(P[i] * 1e6);
            t[i] = T_SAT[i] + KELVIN;
            hf[i] = H_F[i] * 1e3;
            hg[i] = H_G[i] * 1e3;
            rhof[i] = 1 / V_F[i];
            lnRhog[i] = FastMath.log(1 / V_G[i]);
            sf[i] = S_F[i] * 1e3;
            sg[i] = S_G[i] * 1e3;
            muf[i] = MU_F[i] * 1e-6;
            mug[i] = MU_G[i] * 1e-6;
            cpf[i] = CP_F[i] * 1e3;
            cpg[i] = CP_G[i] * 1e3;
            sig[i] = SIGMA[i] * 1e-3;
        }
        minPressure = P[0] * 1e6;
        maxPressure = P[n - 1] * 1e6;

        tSat = new TabulatedFunction(lnP, t);
        hF = new TabulatedFunction(lnP, hf);
        hG = new TabulatedFunction(lnP, hg);
        rhoF = new TabulatedFunction(lnP, rhof);
        lnRhoG = new TabulatedFunction(lnP, lnRhog);
        sF = new TabulatedFunction(lnP, sf);
        sG = new TabulatedFunction(lnP, sg);
        muF = new TabulatedFunction(lnP, muf);
        muG = new TabulatedFunction(lnP, mug);
        kF = new TabulatedFunction(lnP, K_F);
        kG = new TabulatedFunction(lnP, K_G);
        cpF = new TabulatedFunction(lnP, cpf);
        cpG = new TabulatedFunction(lnP, cpg);
        sigma = new TabulatedFunction(lnP, sig);

        liquidTemperatureByH = new TabulatedFunction(hf, t);
        liquidDensityByH = new TabulatedFunction(hf, rhof);
        liquidEntropyByH = new TabulatedFunction(hf, sf);
        liquidViscosityByH = new TabulatedFunction(hf, muf);
        liquidConductivityByH = new TabulatedFunction(hf, K_F);
        liquidHeatCapacityByH = new TabulatedFunction(hf, cpf);
        liquidEnthalpyByT = new TabulatedFunction(t, hf);
        liquidEnthalpyByS = new TabulatedFunction(sf, hf);

        cache = CacheBuilder.newBuilder()
                .maximumSize(cacheSize)
                .build();
    }

    public double getMinPressure() {
        return minPressure;
    }

    public double getMaxPressure() {
        return maxPressure;
    }

    private double lnP(double p) {
        return FastMath.log(FastMath.max(minPressure, FastMath.min(maxPressure, p)));
    }

    @Override
    public SaturationValues saturationEnthalpy(double p) {
        double x = lnP(p);
        return new SaturationValues(hF.value(x), hG.value(x));
    }

    @Override
    public SaturationValues saturationDensity(double p) {
        double x = lnP(p);
        return new SaturationValues(rhoF.value(x), FastMath.exp(lnRhoG.value(x)));
    }

    @Override
    public SaturationValues saturationViscosity(double p) {
        double x = lnP(p);
        return new SaturationValues(muF.value(x), muG.value(x));
    }

    @Override
    public SaturationValues saturationConductivity(double p) {
        double x = lnP(p);
        return new SaturationValues(kF.value(x), kG.value(x));
    }

    @Override
    public SaturationValues saturationHeatCapacity(double p) {
        double x = lnP(p);
        return new SaturationValues(cpF.value(x), cpG.value(x));
    }

    @Override
    public SaturationValues saturationEntropy(double p) {
        double x = lnP(p);
        return new SaturationValues(sF.value(x), sG.value(x));
    }

    @Override
    public double saturationTemperature(double p) {
        return tSat.value(lnP(p));
    }

    @Override
    public double surfaceTension(double p) {
        return sigma.value(lnP(p));
    }

    @Override
    public double enthalpyPT(double p, double t) {
        double tsat = saturationTemperature(p);
        SaturationValues hSat = saturationEnthalpy(p);
        if (t <= tsat) {
            return hSat.liquid() + liquidEnthalpyByT.value(t) - liquidEnthalpyByT.value(tsat);
        }
        return hSat.vapor() + saturationHeatCapacity(p).vapor() * (t - tsat);
    }

    @Override
    protected double singlePhaseEnthalpyPS(double p, double s) {
        SaturationValues sSat = saturationEntropy(p);
        SaturationValues hSat = saturationEnthalpy(p);
        if (s <= sSat.liquid()) {
            return hSat.liquid() + liquidEnthalpyByS.value(s) - liquidEnthalpyByS.value(sSat.liquid());
        }
        double tsat = saturationTemperature(p);
        double cpg = saturationHeatCapacity(p).vapor();
        double t = tsat * FastMath.exp((s - sSat.vapor()) / cpg);
        return hSat.vapor() + cpg * (t - tsat);
    }

    @Override
    protected double singlePhaseDensity(double p, double h) {
        return getState(p, h).density();
    }

    @Override
    protected double singlePhaseViscosity(double p, double h) {
        return getState(p, h).viscosity();
    }

    @Override
    protected double singlePhaseConductivity(double p, double h) {
        return getState(p, h).conductivity();
    }

    @Override
    protected double singlePhaseHeatCapacity(double p, double h) {
        return getState(p, h).heatCapacity();
    }

    @Override
    protected double singlePhaseTemperature(double p, double h) {
        return getState(p, h).temperature();
    }

    @Override
    protected double singlePhaseEntropy(double p, double h) {
        return getState(p, h).entropy();
    }

    private State getState(double p, double h) {
        StateKey key = new StateKey(FastMath.round(p * PRESSURE_ROUNDING), FastMath.round(h * ENTHALPY_ROUNDING));
        State state = cache.getIfPresent(key);
        if (state == null) {
            state = computeState(key.p() / PRESSURE_ROUNDING, key.h() / ENTHALPY_ROUNDING);
            cache.put(key, state);
        }
        return state;
    }

    private State computeState(double p, double h) {
        double x = lnP(p);
        double hf = hF.value(x);
        if (h <= hf) {
            return new State(tSat.value(x) + liquidTemperatureByH.value(h) - liquidTemperatureByH.value(hf),
                             rhoF.value(x) + liquidDensityByH.value(h) - liquidDensityByH.value(hf),
                             muF.value(x) + liquidViscosityByH.value(h) - liquidViscosityByH.value(hf),
                             kF.value(x) + liquidConductivityByH.value(h) - liquidConductivityByH.value(hf),
                             cpF.value(x) + liquidHeatCapacityByH.value(h) - liquidHeatCapacityByH.value(hf),
                             sF.value(x) + liquidEntropyByH.value(h) - liquidEntropyByH.value(hf));
        }
        // superheated vapor, also used when asked for a state inside the dome
        double hg = hG.value(x);
        double tsat = tSat.value(x);
        double cpg = cpG.value(x);
        double ratio = (tsat + FastMath.max(0.0, h - hg) / cpg) / tsat;
        return new State(tsat * ratio,
                         FastMath.exp(lnRhoG.value(x)) / ratio,
                         muG.value(x) * FastMath.pow(ratio, 0.7),
                         kG.value(x) * ratio,
                         cpg,
                         sG.value(x) + cpg * FastMath.log(ratio));
    }
}
