/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network.components;

import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.network.AbstractComponent;
import com.powsybl.openth.network.ComponentType;
import com.powsybl.openth.network.ConfigurationError;
import com.powsybl.openth.network.Connection;
import com.powsybl.openth.props.FluidProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Adiabatic junction of at least two inlets, whatever their port names, into one outlet. Every inlet is at the
 * outlet pressure.
 */
public class Mixer extends AbstractComponent {

    public Mixer(String name) {
        super(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.MIXER;
    }

    @Override
    protected List<String> getRequiredInlets() {
        return Collections.emptyList();
    }

    @Override
    protected void validateParameters(List<ConfigurationError> errors) {
        if (getInlets().size() < 2) {
            errors.add(new ConfigurationError(name, "inlets", "must be at least 2, found " + getInlets().size()));
        }
    }

    @Override
    public List<Equation> equations(FluidProperties props) {
        Connection out = requireOutlet(OUT);
        checkParameters();

        double pOut = out.getP().getValue();
        List<Equation> equations = new ArrayList<>(getInlets().size() + 2);
        double mSum = 0;
        double energySum = 0;
        for (Map.Entry<String, Connection> e : getInlets().entrySet()) {
            Connection in = e.getValue();
            equations.add(Equation.pressure(name + ".p_eq_" + e.getKey(), pOut - in.getP().getValue(), pOut));
            mSum += in.getM().getValue();
            energySum += in.getM().getValue() * in.getH().getValue();
        }
        double mOut = out.getM().getValue();
        equations.add(Equation.mass(name + ".mass", mOut - mSum, mSum));
        equations.add(Equation.energy(name + ".energy", mOut * out.getH().getValue() - energySum, energySum));
        return equations;
    }
}
