/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

/**
 * Two-phase friction pressure drop model.
 */
public enum TwoPhaseFrictionModel {
    /**
     * Homogeneous-equilibrium mixture with mid-state density and viscosity.
     */
    HOMOGENEOUS,
    /**
     * Liquid-only pressure drop times the Chisholm two-phase multiplier.
     */
    CHISHOLM
}
