/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.props;

import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Natural cubic spline through tabulated points, extended linearly outside of the knot range so that it stays
 * continuous and differentiable for the finite difference Jacobian.
 */
final class TabulatedFunction {

    private final PolynomialSplineFunction spline;

    private final double xMin;
    private final double xMax;
    private final double yMin;
    private final double yMax;
    private final double slopeMin;
    private final double slopeMax;

    TabulatedFunction(double[] x, double[] y) {
        spline = new SplineInterpolator().interpolate(x, y);
        PolynomialSplineFunction derivative = spline.polynomialSplineDerivative();
        xMin = x[0];
        xMax = x[x.length - 1];
        yMin = spline.value(xMin);
        yMax = spline.value(xMax);
        slopeMin = derivative.value(xMin);
        slopeMax = derivative.value(xMax);
    }

    double value(double x) {
        if (x < xMin) {
            return yMin + slopeMin * (x - xMin);
        }
        if (x > xMax) {
            return yMax + slopeMax * (x - xMax);
        }
        return spline.value(x);
    }

    double getMinX() {
        return xMin;
    }

    double getMaxX() {
        return xMax;
    }
}
