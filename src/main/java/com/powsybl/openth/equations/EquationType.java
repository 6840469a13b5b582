/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

/**
 * Physical nature of a residual equation, used to group mismatches in diagnostics.
 */
public enum EquationType {
    MASS("m"),
    ENERGY("e"),
    MOMENTUM("dp"),
    PRESSURE("p"),
    ENTHALPY("h"),
    VOID_FRACTION("alpha");

    private final String symbol;

    EquationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
