/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.correlations.HydraulicParameters;
import com.powsybl.openth.correlations.PressureDropBreakdown;
import com.powsybl.openth.correlations.PressureDrops;
import com.powsybl.openth.correlations.TwoPhaseFrictionModel;
import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.equations.Variable;
import com.powsybl.openth.network.AbstractComponent;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Heated channel of a boiling core.
 * <p>
 * Same equations as a {@link Pipe} with the heat duty held by a private variable and the form losses of the fuel
 * bundle and spacer grids added to the lumped loss coefficient. The channel works in one of two modes:
 * <ul>
 *     <li>{@link Mode#FIXED_POWER}: the heat duty is fixed by the caller, see {@link #setPower(double)},</li>
 *     <li>{@link Mode#TARGET_VOID}: the heat duty is solved for, an extra equation drives the outlet void fraction
 *     to a target, see {@link #setExitVoidFraction(double, double)}.</li>
 * </ul>
 */
public class CoreChannel extends AbstractComponent {

    public enum Mode {
        FIXED_POWER,
        TARGET_VOID
    }

    public static final double DEFAULT_POWER = 1e8;
    public static final double MAX_POWER = 1e12;

    private double length = 4.0;
    private double diameter = 0.08;
    private double area = 0.30;
    private double roughness = 1e-5;
    private double elevation = 4.0;
    private double lossCoefficient = 0;
    private double bundleLossCoefficient = 0;
    private double gridLossCoefficient = 0;
    private int gridCount = 0;
    private TwoPhaseFrictionModel frictionModel = TwoPhaseFrictionModel.HOMOGENEOUS;
    private boolean accelerationIncluded = true;

    private final Variable power;

    private Mode mode = Mode.FIXED_POWER;

    private double targetVoidFraction = Double.NaN;

    public CoreChannel(String name) {
        super(name);
        power = new Variable(name + ".Q", DEFAULT_POWER, true, -MAX_POWER, MAX_POWER);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.CORE_CHANNEL;
    }

    @Override
    public List<Variable> getVariables() {
        return List.of(power);
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Heat duty [W], solved for in {@link Mode#TARGET_VOID} mode.
     */
    public double getPower() {
        return power.getValue();
    }

    public Variable getPowerVariable() {
        return power;
    }

    /**
     * Target outlet void fraction, NaN in {@link Mode#FIXED_POWER} mode.
     */
    public double getTargetVoidFraction() {
        return targetVoidFraction;
    }

    /**
     * Switch to {@link Mode#FIXED_POWER} mode with the given heat duty [W].
     */
    public CoreChannel setPower(double power) {
        this.power.fix(power);
        targetVoidFraction = Double.NaN;
        mode = Mode.FIXED_POWER;
        return this;
    }

    /**
     * Switch to {@link Mode#TARGET_VOID} mode: the heat duty becomes an unknown initialized to the given guess [W].
     */
    public CoreChannel setExitVoidFraction(double voidFraction, double powerGuess) {
        if (voidFraction < 0 || voidFraction > 1) {
            throw new IllegalArgumentException("Invalid void fraction target: " + voidFraction);
        }
        targetVoidFraction = voidFraction;
        power.setValue(powerGuess);
        power.unfix();
        mode = Mode.TARGET_VOID;
        return this;
    }

    public CoreChannel setExitVoidFraction(double voidFraction) {
        return setExitVoidFraction(voidFraction, DEFAULT_POWER);
    }

    public double getLength() {
        return length;
    }

    public CoreChannel setLength(double length) {
        this.length = length;
        return this;
    }

    public double getDiameter() {
        return diameter;
    }

    public CoreChannel setDiameter(double diameter) {
        this.diameter = diameter;
        return this;
    }

    public double getArea() {
        return Double.isNaN(area) ? HydraulicParameters.circularArea(diameter) : area;
    }

    public CoreChannel setArea(double area) {
        this.area = area;
        return this;
    }

    public double getRoughness() {
        return roughness;
    }

    public CoreChannel setRoughness(double roughness) {
        this.roughness = roughness;
        return this;
    }

    public double getElevation() {
        return elevation;
    }

    public CoreChannel setElevation(double elevation) {
        this.elevation = elevation;
        return this;
    }

    public double getLossCoefficient() {
        return lossCoefficient;
    }

    public CoreChannel setLossCoefficient(double lossCoefficient) {
        this.lossCoefficient = lossCoefficient;
        return this;
    }

    public double getBundleLossCoefficient() {
        return bundleLossCoefficient;
    }

    public CoreChannel setBundleLossCoefficient(double bundleLossCoefficient) {
        this.bundleLossCoefficient = bundleLossCoefficient;
        return this;
    }

    public double getGridLossCoefficient() {
        return gridLossCoefficient;
    }

    public CoreChannel setGridLossCoefficient(double gridLossCoefficient) {
        this.gridLossCoefficient = gridLossCoefficient;
        return this;
    }

    public int getGridCount() {
        return gridCount;
    }

    public CoreChannel setGridCount(int gridCount) {
        this.gridCount = gridCount;
        return this;
    }

    public TwoPhaseFrictionModel getFrictionModel() {
        return frictionModel;
    }

    public CoreChannel setFrictionModel(TwoPhaseFrictionModel frictionModel) {
        this.frictionModel = Objects.requireNonNull(frictionModel);
        return this;
    }

    public boolean isAccelerationIncluded() {
        return accelerationIncluded;
    }

    public CoreChannel setAccelerationIncluded(boolean accelerationIncluded) {
        this.accelerationIncluded = accelerationIncluded;
        return this;
    }

    /**
     * Base, bundle and spacer grid losses lumped in a single coefficient.
     */
    public double getTotalLossCoefficient() {
        return lossCoefficient + bundleLossCoefficient + gridCount * gridLossCoefficient;
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        checkPositive(errors, name, "diameter", diameter);
        checkPositive(errors, name, "area", getArea());
        if (gridCount < 0) {
            errors.add(new ConfigurationError(name, "gridCount", "must be positive: " + gridCount));
        }
    }

    public PressureDropBreakdown getPressureDrop(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        HydraulicParameters parameters = new HydraulicParameters(length, diameter, getArea(), roughness,
                                                                 getTotalLossCoefficient(), elevation,
                                                                 frictionModel, accelerationIncluded);
        return PressureDrops.pipe(props, in.getM().getValue(), in.getP().getValue(), in.getH().getValue(),
                                  out.getP().getValue(), out.getH().getValue(), parameters);
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        double m = in.getM().getValue();
        double pIn = in.getP().getValue();
        double pOut = out.getP().getValue();
        double hOut = out.getH().getValue();
        double hOutTarget = in.getH().getValue() + Pipe.enthalpyRise(power.getValue(), m);
        PressureDropBreakdown dp = getPressureDrop(props);

        List<Equation> equations = new ArrayList<>(4);
        equations.add(Equation.mass(name + ".mass", out.getM().getValue() - m, m));
        equations.add(Equation.enthalpy(name + ".energy", hOut - hOutTarget, hOutTarget));
        equations.add(Equation.momentum(name + ".dp", pIn - pOut - dp.total(), pIn));
        if (mode == Mode.TARGET_VOID) {
            double voidFraction = props.voidFractionPH(pOut, hOut);
            equations.add(Equation.voidFraction(name + ".alpha_out", voidFraction - targetVoidFraction, targetVoidFraction));
        }
        return equations;
    }
}
