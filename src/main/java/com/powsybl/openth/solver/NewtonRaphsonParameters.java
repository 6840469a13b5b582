/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.commons.config.PlatformConfig;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Newton-Raphson solver parameters. Defaults can be overridden in the platform configuration module
 * {@value #MODULE_NAME} or from a map of properties.
 */
public class NewtonRaphsonParameters {

    public static final String MODULE_NAME = "open-th-default-parameters";

    public static final String MAX_ITERATIONS_PARAM_NAME = "maxIterations";
    public static final String RESIDUAL_TOLERANCE_PARAM_NAME = "residualTolerance";
    public static final String STEP_TOLERANCE_PARAM_NAME = "stepTolerance";
    public static final String FINITE_DIFFERENCE_STEP_PARAM_NAME = "finiteDifferenceStep";
    public static final String DAMPING_ENABLED_PARAM_NAME = "dampingEnabled";
    public static final String DIAGNOSTICS_VERBOSITY_PARAM_NAME = "diagnosticsVerbosity";
    public static final String STOPPING_CRITERIA_TYPE_PARAM_NAME = "stoppingCriteriaType";
    public static final String LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME = "lineSearchMaxIterations";
    public static final String LINE_SEARCH_STEP_FOLD_PARAM_NAME = "lineSearchStepFold";
    public static final String WORST_RESIDUAL_COUNT_PARAM_NAME = "worstResidualCount";

    public static final List<String> PARAMETERS_NAMES = List.of(MAX_ITERATIONS_PARAM_NAME,
                                                                RESIDUAL_TOLERANCE_PARAM_NAME,
                                                                STEP_TOLERANCE_PARAM_NAME,
                                                                FINITE_DIFFERENCE_STEP_PARAM_NAME,
                                                                DAMPING_ENABLED_PARAM_NAME,
                                                                DIAGNOSTICS_VERBOSITY_PARAM_NAME,
                                                                STOPPING_CRITERIA_TYPE_PARAM_NAME,
                                                                LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME,
                                                                LINE_SEARCH_STEP_FOLD_PARAM_NAME,
                                                                WORST_RESIDUAL_COUNT_PARAM_NAME);

    public static final int DEFAULT_MAX_ITERATIONS = 60;
    public static final double DEFAULT_RESIDUAL_TOLERANCE = 1e-7;
    public static final double DEFAULT_STEP_TOLERANCE = 1e-9;
    public static final double DEFAULT_FINITE_DIFFERENCE_STEP = 1e-6;
    public static final boolean DEFAULT_DAMPING_ENABLED = true;
    public static final DiagnosticsVerbosity DEFAULT_DIAGNOSTICS_VERBOSITY = DiagnosticsVerbosity.SUMMARY;
    public static final StoppingCriteriaType DEFAULT_STOPPING_CRITERIA_TYPE = StoppingCriteriaType.RESIDUAL_NORM;
    public static final int DEFAULT_WORST_RESIDUAL_COUNT = 5;

    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    private double residualTolerance = DEFAULT_RESIDUAL_TOLERANCE;

    private double stepTolerance = DEFAULT_STEP_TOLERANCE;

    private double finiteDifferenceStep = DEFAULT_FINITE_DIFFERENCE_STEP;

    private boolean dampingEnabled = DEFAULT_DAMPING_ENABLED;

    private DiagnosticsVerbosity diagnosticsVerbosity = DEFAULT_DIAGNOSTICS_VERBOSITY;

    private StoppingCriteriaType stoppingCriteriaType = DEFAULT_STOPPING_CRITERIA_TYPE;

    private int lineSearchMaxIterations = LineSearchStateVectorScaling.DEFAULT_MAX_ITERATION;

    private double lineSearchStepFold = LineSearchStateVectorScaling.DEFAULT_STEP_FOLD;

    private int worstResidualCount = DEFAULT_WORST_RESIDUAL_COUNT;

    public static int checkMaxIteration(int maxIteration) {
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Invalid max iteration value: " + maxIteration);
        }
        return maxIteration;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public NewtonRaphsonParameters setMaxIterations(int maxIterations) {
        this.maxIterations = checkMaxIteration(maxIterations);
        return this;
    }

    public double getResidualTolerance() {
        return residualTolerance;
    }

    public NewtonRaphsonParameters setResidualTolerance(double residualTolerance) {
        if (!(residualTolerance > 0)) {
            throw new IllegalArgumentException("Invalid residual tolerance value: " + residualTolerance);
        }
        this.residualTolerance = residualTolerance;
        return this;
    }

    public double getStepTolerance() {
        return stepTolerance;
    }

    public NewtonRaphsonParameters setStepTolerance(double stepTolerance) {
        if (!(stepTolerance >= 0)) {
            throw new IllegalArgumentException("Invalid step tolerance value: " + stepTolerance);
        }
        this.stepTolerance = stepTolerance;
        return this;
    }

    /**
     * Relative finite difference step: a variable of value x is perturbed by step * max(1, |x|).
     */
    public double getFiniteDifferenceStep() {
        return finiteDifferenceStep;
    }

    public NewtonRaphsonParameters setFiniteDifferenceStep(double finiteDifferenceStep) {
        if (!(finiteDifferenceStep > 0)) {
            throw new IllegalArgumentException("Invalid finite difference step value: " + finiteDifferenceStep);
        }
        this.finiteDifferenceStep = finiteDifferenceStep;
        return this;
    }

    public boolean isDampingEnabled() {
        return dampingEnabled;
    }

    public NewtonRaphsonParameters setDampingEnabled(boolean dampingEnabled) {
        this.dampingEnabled = dampingEnabled;
        return this;
    }

    public StateVectorScalingMode getStateVectorScalingMode() {
        return dampingEnabled ? StateVectorScalingMode.LINE_SEARCH : StateVectorScalingMode.NONE;
    }

    public DiagnosticsVerbosity getDiagnosticsVerbosity() {
        return diagnosticsVerbosity;
    }

    public NewtonRaphsonParameters setDiagnosticsVerbosity(DiagnosticsVerbosity diagnosticsVerbosity) {
        this.diagnosticsVerbosity = Objects.requireNonNull(diagnosticsVerbosity);
        return this;
    }

    public StoppingCriteriaType getStoppingCriteriaType() {
        return stoppingCriteriaType;
    }

    public NewtonRaphsonParameters setStoppingCriteriaType(StoppingCriteriaType stoppingCriteriaType) {
        this.stoppingCriteriaType = Objects.requireNonNull(stoppingCriteriaType);
        return this;
    }

    public NewtonRaphsonStoppingCriteria createStoppingCriteria() {
        return switch (stoppingCriteriaType) {
            case RESIDUAL_NORM -> new DefaultNewtonRaphsonStoppingCriteria(residualTolerance);
            case PER_EQUATION -> new PerEquationStoppingCriteria(residualTolerance);
        };
    }

    public int getLineSearchMaxIterations() {
        return lineSearchMaxIterations;
    }

    public NewtonRaphsonParameters setLineSearchMaxIterations(int lineSearchMaxIterations) {
        if (lineSearchMaxIterations < 1) {
            throw new IllegalArgumentException("Invalid line search max iteration value: " + lineSearchMaxIterations);
        }
        this.lineSearchMaxIterations = lineSearchMaxIterations;
        return this;
    }

    public double getLineSearchStepFold() {
        return lineSearchStepFold;
    }

    public NewtonRaphsonParameters setLineSearchStepFold(double lineSearchStepFold) {
        if (!(lineSearchStepFold > 1)) {
            throw new IllegalArgumentException("Invalid line search step fold value: " + lineSearchStepFold);
        }
        this.lineSearchStepFold = lineSearchStepFold;
        return this;
    }

    /**
     * Number of largest scaled residuals logged and reported at each iteration.
     */
    public int getWorstResidualCount() {
        return worstResidualCount;
    }

    public NewtonRaphsonParameters setWorstResidualCount(int worstResidualCount) {
        if (worstResidualCount < 0) {
            throw new IllegalArgumentException("Invalid worst residual count value: " + worstResidualCount);
        }
        this.worstResidualCount = worstResidualCount;
        return this;
    }

    public static NewtonRaphsonParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static NewtonRaphsonParameters load(PlatformConfig platformConfig) {
        NewtonRaphsonParameters parameters = new NewtonRaphsonParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setMaxIterations(config.getIntProperty(MAX_ITERATIONS_PARAM_NAME, DEFAULT_MAX_ITERATIONS))
                        .setResidualTolerance(config.getDoubleProperty(RESIDUAL_TOLERANCE_PARAM_NAME, DEFAULT_RESIDUAL_TOLERANCE))
                        .setStepTolerance(config.getDoubleProperty(STEP_TOLERANCE_PARAM_NAME, DEFAULT_STEP_TOLERANCE))
                        .setFiniteDifferenceStep(config.getDoubleProperty(FINITE_DIFFERENCE_STEP_PARAM_NAME, DEFAULT_FINITE_DIFFERENCE_STEP))
                        .setDampingEnabled(config.getBooleanProperty(DAMPING_ENABLED_PARAM_NAME, DEFAULT_DAMPING_ENABLED))
                        .setDiagnosticsVerbosity(config.getEnumProperty(DIAGNOSTICS_VERBOSITY_PARAM_NAME, DiagnosticsVerbosity.class, DEFAULT_DIAGNOSTICS_VERBOSITY))
                        .setStoppingCriteriaType(config.getEnumProperty(STOPPING_CRITERIA_TYPE_PARAM_NAME, StoppingCriteriaType.class, DEFAULT_STOPPING_CRITERIA_TYPE))
                        .setLineSearchMaxIterations(config.getIntProperty(LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME, LineSearchStateVectorScaling.DEFAULT_MAX_ITERATION))
                        .setLineSearchStepFold(config.getDoubleProperty(LINE_SEARCH_STEP_FOLD_PARAM_NAME, LineSearchStateVectorScaling.DEFAULT_STEP_FOLD))
                        .setWorstResidualCount(config.getIntProperty(WORST_RESIDUAL_COUNT_PARAM_NAME, DEFAULT_WORST_RESIDUAL_COUNT)));
        return parameters;
    }

    public static NewtonRaphsonParameters load(Map<String, String> properties) {
        return new NewtonRaphsonParameters()
                .update(properties);
    }

    public NewtonRaphsonParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(MAX_ITERATIONS_PARAM_NAME))
                .ifPresent(value -> this.setMaxIterations(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(RESIDUAL_TOLERANCE_PARAM_NAME))
                .ifPresent(value -> this.setResidualTolerance(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(STEP_TOLERANCE_PARAM_NAME))
                .ifPresent(value -> this.setStepTolerance(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(FINITE_DIFFERENCE_STEP_PARAM_NAME))
                .ifPresent(value -> this.setFiniteDifferenceStep(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(DAMPING_ENABLED_PARAM_NAME))
                .ifPresent(value -> this.setDampingEnabled(Boolean.parseBoolean(value)));
        Optional.ofNullable(properties.get(DIAGNOSTICS_VERBOSITY_PARAM_NAME))
                .ifPresent(value -> this.setDiagnosticsVerbosity(DiagnosticsVerbosity.valueOf(value)));
        Optional.ofNullable(properties.get(STOPPING_CRITERIA_TYPE_PARAM_NAME))
                .ifPresent(value -> this.setStoppingCriteriaType(StoppingCriteriaType.valueOf(value)));
        Optional.ofNullable(properties.get(LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME))
                .ifPresent(value -> this.setLineSearchMaxIterations(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(LINE_SEARCH_STEP_FOLD_PARAM_NAME))
                .ifPresent(value -> this.setLineSearchStepFold(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(WORST_RESIDUAL_COUNT_PARAM_NAME))
                .ifPresent(value -> this.setWorstResidualCount(Integer.parseInt(value)));
        return this;
    }

    @Override
    public String toString() {
        return "NewtonRaphsonParameters(" +
                "maxIterations=" + maxIterations +
                ", residualTolerance=" + residualTolerance +
                ", stepTolerance=" + stepTolerance +
                ", finiteDifferenceStep=" + finiteDifferenceStep +
                ", dampingEnabled=" + dampingEnabled +
                ", diagnosticsVerbosity=" + diagnosticsVerbosity +
                ", stoppingCriteriaType=" + stoppingCriteriaType +
                ", lineSearchMaxIterations=" + lineSearchMaxIterations +
                ", lineSearchStepFold=" + lineSearchStepFold +
                ", worstResidualCount=" + worstResidualCount +
                ')';
    }
}
