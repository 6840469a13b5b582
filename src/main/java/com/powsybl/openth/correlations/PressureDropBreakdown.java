/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.correlations;

/**
 * Pressure drop [Pa] of a flow element split by physical contribution. Positive values oppose the flow.
 */
public record PressureDropBreakdown(double friction, double form, double gravity, double acceleration) {

    public double total() {
        return friction + form + gravity + acceleration;
    }
}
