/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

import net.jafama.FastMath;

import java.util.Objects;

/**
 * A named residual, normalized by a characteristic magnitude chosen by the component producing it.
 */
public record Equation(String name, EquationType type, double residual, double scale) {

    /**
     * Guard against a zero scale.
     */
    public static final double SCALE_EPSILON = 1e-12;

    public Equation {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
    }

    public double getScaledResidual() {
        return residual / FastMath.max(FastMath.abs(scale), SCALE_EPSILON);
    }

    /**
     * Residual of a mass flow mismatch, scaled by the flow magnitude.
     */
    public static Equation mass(String name, double residual, double flow) {
        return new Equation(name, EquationType.MASS, residual, FastMath.max(1.0, FastMath.abs(flow)));
    }

    /**
     * Residual of a pressure mismatch, scaled by at least 1 bar.
     */
    public static Equation pressure(String name, double residual, double pressure) {
        return new Equation(name, EquationType.PRESSURE, residual, FastMath.max(1e5, FastMath.abs(pressure)));
    }

    /**
     * Residual of a momentum balance, scaled by at least 1 bar.
     */
    public static Equation momentum(String name, double residual, double pressure) {
        return new Equation(name, EquationType.MOMENTUM, residual, FastMath.max(1e5, FastMath.abs(pressure)));
    }

    /**
     * Residual of a specific enthalpy mismatch, scaled by at least 100 kJ/kg.
     */
    public static Equation enthalpy(String name, double residual, double enthalpy) {
        return new Equation(name, EquationType.ENTHALPY, residual, FastMath.max(1e5, FastMath.abs(enthalpy)));
    }

    /**
     * Residual of an energy flow balance [W], scaled by at least 1 MW.
     */
    public static Equation energy(String name, double residual, double energyFlow) {
        return new Equation(name, EquationType.ENERGY, residual, FastMath.max(1e6, FastMath.abs(energyFlow)));
    }

    /**
     * Residual of a void fraction target, scaled by the target with a floor of 0.01.
     */
    public static Equation voidFraction(String name, double residual, double target) {
        return new Equation(name, EquationType.VOID_FRACTION, residual, FastMath.max(1e-2, FastMath.abs(target)));
    }
}
