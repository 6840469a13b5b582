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
 * Darcy friction factor correlations.
 */
public final class FrictionFactors {

    public static final double LAMINAR_REYNOLDS_LIMIT = 2300;

    private FrictionFactors() {
    }

    /**
     * Darcy friction factor: 64/Re in laminar flow, Haaland explicit approximation of Colebrook otherwise.
     *
     * @param reynolds Reynolds number, its sign is ignored
     * @param relativeRoughness absolute roughness over hydraulic diameter
     * @return friction factor, 0 for a fluid at rest
     */
    public static double haaland(double reynolds, double relativeRoughness) {
        double re = FastMath.abs(reynolds);
        if (re <= 0) {
            return 0;
        }
        if (re < LAMINAR_REYNOLDS_LIMIT) {
            return 64 / re;
        }
        double a = -1.8 * FastMath.log10(FastMath.pow(relativeRoughness / 3.7, 1.11) + 6.9 / re);
        return 1 / (a * a);
    }
}
