/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.math.matrix.DenseMatrixFactory;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.math.matrix.MatrixFactory;
import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.equations.EquationType;
import com.powsybl.openth.equations.Variable;
import com.powsybl.openth.equations.Vectors;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.ConfigurationException;
import com.powsybl.openth.network.Network;
import com.powsybl.openth.util.Reports;
import org.apache.commons.lang3.mutable.MutableInt;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Damped Newton-Raphson solver of a network, with a Jacobian approximated by finite differences.
 * <p>
 * The unknowns are the free variables of the network and the residuals are the scaled residuals of every
 * component equation. Configuration errors are thrown before any evaluation, any numerical failure ends up in the
 * returned result.
 */
public class NewtonRaphson {

    private static final Logger LOGGER = LoggerFactory.getLogger(NewtonRaphson.class);

    private final Network network;

    private final NewtonRaphsonParameters parameters;

    private final MatrixFactory matrixFactory;

    private final List<NewtonRaphsonObserver> observers = new ArrayList<>();

    private List<Variable> variables;

    private NewtonRaphsonStoppingCriteria stoppingCriteria;

    public NewtonRaphson(Network network, NewtonRaphsonParameters parameters) {
        this(network, parameters, new DenseMatrixFactory());
    }

    public NewtonRaphson(Network network, NewtonRaphsonParameters parameters, MatrixFactory matrixFactory) {
        this.network = Objects.requireNonNull(network);
        this.parameters = Objects.requireNonNull(parameters);
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
    }

    public NewtonRaphson addObserver(NewtonRaphsonObserver observer) {
        observers.add(Objects.requireNonNull(observer));
        return this;
    }

    private boolean isDetailed() {
        return parameters.getDiagnosticsVerbosity() == DiagnosticsVerbosity.DETAILED;
    }

    private double[] evaluateScaledResiduals() {
        return Vectors.getScaledResiduals(network.getEquations());
    }

    private NewtonRaphsonStoppingCriteria.TestResult evaluate(double[] x) {
        Vectors.setValues(variables, x);
        return stoppingCriteria.test(evaluateScaledResiduals());
    }

    public static List<Pair<Equation, Double>> findLargestMismatches(List<Equation> equations, double[] fx, int count) {
        return IntStream.range(0, equations.size())
                .mapToObj(i -> Pair.of(equations.get(i), fx[i]))
                .sorted(Comparator.comparingDouble((Pair<Equation, Double> p) -> Math.abs(p.getValue())).reversed())
                .limit(count)
                .toList();
    }

    public static Map<EquationType, Pair<Equation, Double>> getLargestMismatchByEquationType(List<Equation> equations, double[] fx) {
        return IntStream.range(0, equations.size())
                .mapToObj(i -> Pair.of(equations.get(i), fx[i]))
                .collect(Collectors.toMap(p -> p.getKey().type(),
                                          p -> p,
                                          BinaryOperator.maxBy(Comparator.comparingDouble((Pair<Equation, Double> p) -> Math.abs(p.getValue()))),
                                          () -> new EnumMap<>(EquationType.class)));
    }

    private void reportAndLogLargestMismatches(ReportNode iterationReportNode, List<Equation> equations, double[] fx) {
        if (LOGGER.isTraceEnabled()) {
            findLargestMismatches(equations, fx, parameters.getWorstResidualCount())
                    .forEach(p -> LOGGER.trace("Mismatch for {}: {} (raw={})", p.getKey().name(), p.getValue(), p.getKey().residual()));
        }
        if (iterationReportNode != null) {
            getLargestMismatchByEquationType(equations, fx)
                    .forEach((type, p) -> Reports.reportNewtonRaphsonLargestMismatch(iterationReportNode, type.name(),
                            p.getKey().name(), p.getValue(), p.getKey().residual()));
        }
    }

    private NewtonRaphsonResult runIteration(JacobianMatrix j, StateVectorScaling svScaling, MutableInt iterations,
                                             ReportNode reportNode) {
        int iteration = iterations.intValue() + 1;
        LOGGER.debug("Start iteration {}", iteration);
        observers.forEach(o -> o.beginIteration(iteration));

        ReportNode iterationReportNode = isDetailed() ? Reports.createNewtonRaphsonIterationReporter(reportNode, iteration) : null;

        double[] x0 = Vectors.getValues(variables);
        List<Equation> equations = network.getEquations();
        double[] f0 = Vectors.getScaledResiduals(equations);
        NewtonRaphsonStoppingCriteria.TestResult testResult = stoppingCriteria.test(f0);

        LOGGER.debug("|f(x)|={}", testResult.getNorm());
        if (iterationReportNode != null) {
            Reports.reportNewtonRaphsonNorm(iterationReportNode, testResult.getNorm());
        }
        if (iterationReportNode != null || LOGGER.isTraceEnabled()) {
            reportAndLogLargestMismatches(iterationReportNode, equations, f0);
        }

        if (testResult.isStop()) {
            return new NewtonRaphsonResult(NewtonRaphsonStatus.CONVERGED, iteration - 1, testResult.getNorm(),
                                           "Converged (residual norm)");
        }

        double[] dx;
        try {
            if (!Vectors.isFinite(f0)) {
                throw new MatrixException("Non finite residual at current state");
            }
            j.update(variables, f0, this::evaluateScaledResiduals);
            double[] b = f0.clone();
            Vectors.mult(b, -1);
            dx = j.solve(b);
        } catch (MatrixException e) {
            LOGGER.error(e.toString(), e);
            Vectors.setValues(variables, x0);
            Reports.reportNewtonRaphsonError(reportNode, e.getMessage());
            return new NewtonRaphsonResult(NewtonRaphsonStatus.SOLVER_FAILED, iteration, testResult.getNorm(),
                                           "Linear solve failed: " + e.getMessage());
        }

        if (Vectors.norm2(dx) < parameters.getStepTolerance()) {
            return new NewtonRaphsonResult(NewtonRaphsonStatus.CONVERGED, iteration, testResult.getNorm(),
                                           "Converged (step norm)");
        }

        StateVectorScaling.Step step = svScaling.apply(x0, dx, testResult, this::evaluate, iterationReportNode);
        if (!step.accepted()) {
            return new NewtonRaphsonResult(NewtonRaphsonStatus.STAGNATION, iteration, testResult.getNorm(),
                                           "Damping failed to improve residual");
        }

        double normAfter = step.testResult().getNorm();
        observers.forEach(o -> o.afterStep(iteration, testResult.getNorm(), normAfter, step.stepSize()));
        iterations.increment();
        return null;
    }

    private void checkConfiguration() {
        List<ConfigurationError> errors = network.validate();
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    /**
     * Solve the network, the free variables being updated in place.
     *
     * @throws ConfigurationException if the network is not properly configured
     */
    public NewtonRaphsonResult run(ReportNode reportNode) {
        Objects.requireNonNull(reportNode);
        checkConfiguration();

        variables = network.getFreeVariables();
        stoppingCriteria = parameters.createStoppingCriteria();

        NewtonRaphsonResult result;
        if (variables.isEmpty()) {
            NewtonRaphsonStoppingCriteria.TestResult testResult = stoppingCriteria.test(evaluateScaledResiduals());
            result = new NewtonRaphsonResult(testResult.isStop() ? NewtonRaphsonStatus.CONVERGED : NewtonRaphsonStatus.NO_CALCULATION,
                                             0, testResult.getNorm(), "No free variables");
        } else {
            if (parameters.getDiagnosticsVerbosity() != DiagnosticsVerbosity.QUIET) {
                Reports.reportNewtonRaphsonSystemSize(reportNode, variables.size(), network.getEquations().size());
            }

            JacobianMatrix j = new JacobianMatrix(matrixFactory, parameters.getFiniteDifferenceStep());
            StateVectorScaling svScaling = StateVectorScaling.fromParameters(parameters);

            result = null;
            MutableInt iterations = new MutableInt();
            while (result == null && iterations.intValue() < parameters.getMaxIterations()) {
                result = runIteration(j, svScaling, iterations, reportNode);
            }

            if (result == null) {
                // the last step may have met the tolerance
                NewtonRaphsonStoppingCriteria.TestResult testResult = stoppingCriteria.test(evaluateScaledResiduals());
                result = testResult.isStop()
                        ? new NewtonRaphsonResult(NewtonRaphsonStatus.CONVERGED, iterations.intValue(), testResult.getNorm(), "Converged (residual norm)")
                        : new NewtonRaphsonResult(NewtonRaphsonStatus.MAX_ITERATION_REACHED, iterations.intValue(), testResult.getNorm(), "Max iterations reached");
            }
        }

        LOGGER.info("Newton-Raphson completed (status={}, iterations={}, |f(x)|={}): {}",
                result.getStatus(), result.getIterations(), result.getResidualNorm(), result.getMessage());
        Reports.reportNewtonRaphsonComplete(reportNode, result.getStatus().name(), result.getIterations(),
                                            result.getResidualNorm(), result.getMessage());

        NewtonRaphsonResult finalResult = result;
        observers.forEach(o -> o.end(finalResult));
        return result;
    }
}
