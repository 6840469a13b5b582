/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * Functional report of the Newton-Raphson solver.
 */
public final class Reports {

    private static final String ITERATION = "iteration";
    private static final String NORM = "norm";

    private Reports() {
    }

    public static void reportNewtonRaphsonSystemSize(ReportNode reportNode, int variableCount, int equationCount) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.NRSystemSize", "Solving ${equationCount} equations for ${variableCount} unknowns")
                .withUntypedValue("variableCount", variableCount)
                .withUntypedValue("equationCount", equationCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static ReportNode createNewtonRaphsonIterationReporter(ReportNode reportNode, int iteration) {
        return reportNode.newReportNode()
                .withMessageTemplate("openth.NRIteration", "Iteration ${iteration}")
                .withUntypedValue(ITERATION, iteration)
                .add();
    }

    public static void reportNewtonRaphsonNorm(ReportNode reportNode, double norm) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.NRNorm", "Scaled residual norm |f(x)|=${norm}")
                .withUntypedValue(NORM, norm)
                .withSeverity(TypedValue.TRACE_SEVERITY)
                .add();
    }

    public static void reportNewtonRaphsonLargestMismatch(ReportNode reportNode, String equationType, String equationName,
                                                          double scaledResidual, double residual) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.NRMismatch", "Largest ${equationType} mismatch: ${equationName} scaled=${scaledResidual} raw=${residual}")
                .withUntypedValue("equationType", equationType)
                .withUntypedValue("equationName", equationName)
                .withUntypedValue("scaledResidual", scaledResidual)
                .withUntypedValue("residual", residual)
                .withSeverity(TypedValue.TRACE_SEVERITY)
                .add();
    }

    public static void reportLineSearchStepSize(ReportNode reportNode, double stepSize) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.lineSearchStepSize", "Step size: ${stepSize}")
                .withUntypedValue("stepSize", stepSize)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportNewtonRaphsonError(ReportNode reportNode, String error) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.NRError", "Newton-Raphson error: ${error}")
                .withUntypedValue("error", error)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportNewtonRaphsonComplete(ReportNode reportNode, String status, int iterationCount, double norm,
                                                   String message) {
        reportNode.newReportNode()
                .withMessageTemplate("openth.NRComplete", "Newton-Raphson completed with status ${status} after ${iterationCount} iterations, |f(x)|=${norm}: ${message}")
                .withUntypedValue("status", status)
                .withUntypedValue("iterationCount", iterationCount)
                .withUntypedValue(NORM, norm)
                .withUntypedValue("message", message)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }
}
