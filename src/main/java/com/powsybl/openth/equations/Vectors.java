/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.equations;

import net.jafama.FastMath;

import java.util.List;

/**
 * Operations on plain {@code double} arrays and on the values of variable and equation lists.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * a = a + b * c
     */
    public static void plus(double[] a, double[] b, double c) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("a and b have different length");
        }
        for (int i = 0; i < a.length; i++) {
            a[i] += b[i] * c;
        }
    }

    /**
     * a = a * b
     */
    public static void mult(double[] a, double b) {
        for (int i = 0; i < a.length; i++) {
            a[i] = a[i] * b;
        }
    }

    public static double norm2(double[] vector) {
        double norm = 0;
        for (double v : vector) {
            norm += v * v;
        }
        return FastMath.sqrt(norm);
    }

    public static double normInf(double[] vector) {
        double norm = 0;
        for (double v : vector) {
            norm = FastMath.max(norm, FastMath.abs(v));
        }
        return norm;
    }

    public static boolean isFinite(double[] vector) {
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double[] getValues(List<Variable> variables) {
        double[] x = new double[variables.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = variables.get(i).getValue();
        }
        return x;
    }

    /**
     * Write x into the variables, each value being clipped into the variable bounds.
     */
    public static void setValues(List<Variable> variables, double[] x) {
        if (variables.size() != x.length) {
            throw new IllegalArgumentException("Variable count " + variables.size() + " and vector length " + x.length + " differ");
        }
        for (int i = 0; i < x.length; i++) {
            variables.get(i).setValue(x[i]);
        }
    }

    public static double[] getScaledResiduals(List<Equation> equations) {
        double[] f = new double[equations.size()];
        for (int i = 0; i < f.length; i++) {
            f[i] = equations.get(i).getScaledResidual();
        }
        return f;
    }
}
