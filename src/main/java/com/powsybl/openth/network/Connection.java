/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import com.powsybl.openth.equations.Variable;

import java.util.List;
import java.util.Objects;

/**
 * Directed flow link between the outlet port of a component and the inlet port of another one, holding the
 * mass flow [kg/s], pressure [Pa] and specific enthalpy [J/kg] of the stream.
 */
public class Connection {

    public static final double MIN_MASS_FLOW = 1e-6;
    public static final double MAX_MASS_FLOW = 1e9;
    public static final double MIN_PRESSURE = 1e3;
    public static final double MAX_PRESSURE = 1e9;
    public static final double MIN_ENTHALPY = 1e3;
    public static final double MAX_ENTHALPY = 1e8;

    private final String name;

    private final Variable m;

    private final Variable p;

    private final Variable h;

    public Connection(String name, Variable m, Variable p, Variable h) {
        this.name = Objects.requireNonNull(name);
        this.m = Objects.requireNonNull(m);
        this.p = Objects.requireNonNull(p);
        this.h = Objects.requireNonNull(h);
    }

    /**
     * Create a connection with free variables initialized to the given guesses and default physical bounds.
     */
    public static Connection create(String name, double mGuess, double pGuess, double hGuess) {
        Objects.requireNonNull(name);
        return new Connection(name,
                new Variable(name + ".m", mGuess, false, MIN_MASS_FLOW, MAX_MASS_FLOW),
                new Variable(name + ".p", pGuess, false, MIN_PRESSURE, MAX_PRESSURE),
                new Variable(name + ".h", hGuess, false, MIN_ENTHALPY, MAX_ENTHALPY));
    }

    public String getName() {
        return name;
    }

    public Variable getM() {
        return m;
    }

    public Variable getP() {
        return p;
    }

    public Variable getH() {
        return h;
    }

    public List<Variable> getVariables() {
        return List.of(m, p, h);
    }

    /**
     * Fix some of the variables, a null value leaves the corresponding variable untouched.
     */
    public Connection fix(Double mValue, Double pValue, Double hValue) {
        if (mValue != null) {
            m.fix(mValue);
        }
        if (pValue != null) {
            p.fix(pValue);
        }
        if (hValue != null) {
            h.fix(hValue);
        }
        return this;
    }

    /**
     * Overwrite the value of some of the variables without changing their fixed status, a null value leaves the
     * corresponding variable untouched.
     */
    public Connection guess(Double mValue, Double pValue, Double hValue) {
        if (mValue != null) {
            m.setValue(mValue);
        }
        if (pValue != null) {
            p.setValue(pValue);
        }
        if (hValue != null) {
            h.setValue(hValue);
        }
        return this;
    }

    @Override
    public String toString() {
        return "Connection(name=" + name + ", m=" + m.getValue() + ", p=" + p.getValue() + ", h=" + h.getValue() + ")";
    }
}
