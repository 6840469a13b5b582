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
import com.powsybl.openth.network.AbstractComponent;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;
import net.jafama.FastMath;

import java.util.List;
import java.util.Objects;

/**
 * One inlet, one outlet pipe, two-phase aware through mixture properties.
 * <p>
 * Equations: mass conservation, energy {@code h_out = h_in + Q/m} and momentum
 * {@code p_in - p_out = dp_friction + dp_form + dp_gravity + dp_acceleration}.
 */
public class Pipe extends AbstractComponent {

    static final double MIN_MASS_FLOW = 1e-9;

    private double length = 1.0;
    private double diameter = 0.1;
    private double area = Double.NaN;
    private double roughness = 1e-5;
    private double lossCoefficient = 0;
    private double elevation = 0;
    private double heat = 0;
    private TwoPhaseFrictionModel frictionModel = TwoPhaseFrictionModel.HOMOGENEOUS;
    private boolean accelerationIncluded = true;

    public Pipe(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.PIPE;
    }

    public double getLength() {
        return length;
    }

    public Pipe setLength(double length) {
        this.length = length;
        return this;
    }

    public double getDiameter() {
        return diameter;
    }

    public Pipe setDiameter(double diameter) {
        this.diameter = diameter;
        return this;
    }

    /**
     * Flow area, defaults to the area of a circle of the hydraulic diameter.
     */
    public double getArea() {
        return Double.isNaN(area) ? HydraulicParameters.circularArea(diameter) : area;
    }

    public Pipe setArea(double area) {
        this.area = area;
        return this;
    }

    public double getRoughness() {
        return roughness;
    }

    public Pipe setRoughness(double roughness) {
        this.roughness = roughness;
        return this;
    }

    public double getLossCoefficient() {
        return lossCoefficient;
    }

    public Pipe setLossCoefficient(double lossCoefficient) {
        this.lossCoefficient = lossCoefficient;
        return this;
    }

    /**
     * Outlet elevation minus inlet elevation [m].
     */
    public double getElevation() {
        return elevation;
    }

    public Pipe setElevation(double elevation) {
        this.elevation = elevation;
        return this;
    }

    /**
     * Heat added to the fluid [W], 0 for an adiabatic pipe.
     */
    public double getHeat() {
        return heat;
    }

    public Pipe setHeat(double heat) {
        this.heat = heat;
        return this;
    }

    public TwoPhaseFrictionModel getFrictionModel() {
        return frictionModel;
    }

    public Pipe setFrictionModel(TwoPhaseFrictionModel frictionModel) {
        this.frictionModel = Objects.requireNonNull(frictionModel);
        return this;
    }

    public boolean isAccelerationIncluded() {
        return accelerationIncluded;
    }

    public Pipe setAccelerationIncluded(boolean accelerationIncluded) {
        this.accelerationIncluded = accelerationIncluded;
        return this;
    }

    protected HydraulicParameters getHydraulicParameters() {
        return new HydraulicParameters(length, diameter, getArea(), roughness, lossCoefficient, elevation,
                                       frictionModel, accelerationIncluded);
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        checkPositive(errors, name, "diameter", diameter);
        checkPositive(errors, name, "area", getArea());
        if (length < 0) {
            errors.add(new ConfigurationError(name, "length", "must be positive: " + length));
        }
    }

    /**
     * Pressure drop breakdown at the current state of the connections.
     */
    public PressureDropBreakdown getPressureDrop(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        return PressureDrops.pipe(props, in.getM().getValue(), in.getP().getValue(), in.getH().getValue(),
                                  out.getP().getValue(), out.getH().getValue(), getHydraulicParameters());
    }

    static double enthalpyRise(double heat, double massFlow) {
        return FastMath.abs(massFlow) > MIN_MASS_FLOW ? heat / massFlow : 0;
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection in = requireInlet(IN);
        Connection out = requireOutlet(OUT);
        double m = in.getM().getValue();
        double pIn = in.getP().getValue();
        double hOutTarget = in.getH().getValue() + enthalpyRise(heat, m);
        PressureDropBreakdown dp = getPressureDrop(props);
        return List.of(
                Equation.mass(name + ".mass", out.getM().getValue() - m, m),
                Equation.enthalpy(name + ".energy", out.getH().getValue() - hOutTarget, hOutTarget),
                Equation.momentum(name + ".dp", pIn - out.getP().getValue() - dp.total(), pIn));
    }
}
