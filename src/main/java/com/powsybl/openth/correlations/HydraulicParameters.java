/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

import java.util.Objects;

/**
 * Geometry and loss parameters of a pipe-like flow element.
 *
 * @param length length [m]
 * @param diameter hydraulic diameter [m]
 * @param area flow area [m2]
 * @param roughness absolute wall roughness [m]
 * @param lossCoefficient lumped form loss coefficient [-]
 * @param elevation outlet elevation minus inlet elevation [m]
 * @param frictionModel two-phase friction model
 * @param accelerationIncluded whether the acceleration term is part of the pressure drop
 */
public record HydraulicParameters(double length, double diameter, double area, double roughness,
                                  double lossCoefficient, double elevation, TwoPhaseFrictionModel frictionModel,
                                  boolean accelerationIncluded) {

    public HydraulicParameters {
        Objects.requireNonNull(frictionModel);
    }

    public static double circularArea(double diameter) {
        return Math.PI * diameter * diameter / 4;
    }
}
