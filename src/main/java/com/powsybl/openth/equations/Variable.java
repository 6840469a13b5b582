/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

import java.util.Objects;

/**
 * A scalar unknown of the network model.
 * <p>
 * A fixed variable is a boundary condition: the solver never writes it. Bounds are optional (NaN when absent)
 * and the value is clipped into them after every write.
 */
public class Variable {

    private final String name;

    private double value;

    private boolean fixed;

    private final double lowerBound;

    private final double upperBound;

    public Variable(String name, double value) {
        this(name, value, false, Double.NaN, Double.NaN);
    }

    public Variable(String name, double value, boolean fixed, double lowerBound, double upperBound) {
        this.name = Objects.requireNonNull(name);
        if (!Double.isNaN(lowerBound) && !Double.isNaN(upperBound) && lowerBound > upperBound) {
            throw new IllegalArgumentException("Invalid bounds for variable '" + name + "': [" + lowerBound + ", " + upperBound + "]");
        }
        this.fixed = fixed;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        setValue(value);
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
        clip();
    }

    public boolean isFixed() {
        return fixed;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public void fix() {
        fixed = true;
    }

    public void fix(double value) {
        setValue(value);
        fixed = true;
    }

    public void unfix() {
        fixed = false;
    }

    public void clip() {
        if (!Double.isNaN(lowerBound) && value < lowerBound) {
            value = lowerBound;
        }
        if (!Double.isNaN(upperBound) && value > upperBound) {
            value = upperBound;
        }
    }

    @Override
    public String toString() {
        return "Variable(name=" + name + ", value=" + value + ", fixed=" + fixed + ")";
    }
}
