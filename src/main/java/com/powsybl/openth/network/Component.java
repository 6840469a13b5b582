/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.equations.Variable;
import com.powsybl.openth.props.FluidProperties;

import java.util.List;
import java.util.Map;

/**
 * A lumped element of the network, contributing residual equations from the state of the connections attached to
 * its ports and from its own private variables.
 */
public interface Component {

    String getName();

    ComponentType getType();

    Map<String, Connection> getInlets();

    Map<String, Connection> getOutlets();

    /**
     * Attach a connection to an inlet port.
     *
     * @throws ConfigurationException if the port is already connected
     */
    void connectInlet(String port, Connection connection);

    /**
     * Attach a connection to an outlet port.
     *
     * @throws ConfigurationException if the port is already connected
     */
    void connectOutlet(String port, Connection connection);

    /**
     * Private variables of the component, empty for most of them.
     */
    List<Variable> getVariables();

    /**
     * Check ports and parameters without evaluating anything.
     *
     * @return the list of problems found, empty when the component is ready to produce its equations
     */
    List<ConfigurationError> validate();

    /**
     * Residual equations at the current value of the variables. The result only depends on the variables and on
     * the component parameters.
     *
     * @throws PortNotConnectedException if a port used by the equations is not connected
     * @throws ConfigurationException if the parameters are inconsistent
     */
    List<Equation> equations(FluidProperties props);
}
