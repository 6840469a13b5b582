/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import com.powsybl.openth.equations.Variable;

import java.util.*;

/**
 * Port bookkeeping shared by all the components.
 */
public abstract class AbstractComponent implements Component {

    public static final String IN = "in";
    public static final String OUT = "out";

    protected final String name;

    private final Map<String, Connection> inlets = new LinkedHashMap<>();

    private final Map<String, Connection> outlets = new LinkedHashMap<>();

    protected AbstractComponent(String name) {
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<String, Connection> getInlets() {
        return Collections.unmodifiableMap(inlets);
    }

    @Override
    public Map<String, Connection> getOutlets() {
        return Collections.unmodifiableMap(outlets);
    }

    @Override
    public void connectInlet(String port, Connection connection) {
        connect(inlets, port, connection, "inlet");
    }

    @Override
    public void connectOutlet(String port, Connection connection) {
        connect(outlets, port, connection, "outlet");
    }

    private void connect(Map<String, Connection> ports, String port, Connection connection, String direction) {
        Objects.requireNonNull(port);
        Objects.requireNonNull(connection);
        Connection existing = ports.get(port);
        if (existing != null) {
            throw new ConfigurationException(new ConfigurationError(name, direction + " '" + port + "'",
                    "is already connected to '" + existing.getName() + "'"));
        }
        ports.put(port, connection);
    }

    @Override
    public List<Variable> getVariables() {
        return Collections.emptyList();
    }

    /**
     * Inlet ports the equations need.
     */
    protected List<String> getRequiredInlets() {
        return List.of(IN);
    }

    /**
     * Outlet ports the equations need.
     */
    protected List<String> getRequiredOutlets() {
        return List.of(OUT);
    }

    /**
     * Add parameter problems to the error list.
     */
    protected void validateParameters(List<ConfigurationError> errors) {
        // nothing to check by default
    }

    @Override
    public List<ConfigurationError> validate() {
        List<ConfigurationError> errors = new ArrayList<>();
        for (String port : getRequiredInlets()) {
            if (!inlets.containsKey(port)) {
                errors.add(new ConfigurationError(name, "inlet '" + port + "'", "is not connected"));
            }
        }
        for (String port : getRequiredOutlets()) {
            if (!outlets.containsKey(port)) {
                errors.add(new ConfigurationError(name, "outlet '" + port + "'", "is not connected"));
            }
        }
        validateParameters(errors);
        return errors;
    }

    /**
     * Throw the first parameter problem, to be called before evaluating the equations.
     */
    protected void checkParameters() {
        List<ConfigurationError> errors = new ArrayList<>();
        validateParameters(errors);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    protected Connection requireInlet(String port) {
        Connection connection = inlets.get(port);
        if (connection == null) {
            throw new PortNotConnectedException(name, port, true);
        }
        return connection;
    }

    protected Connection requireOutlet(String port) {
        Connection connection = outlets.get(port);
        if (connection == null) {
            throw new PortNotConnectedException(name, port, false);
        }
        return connection;
    }

    protected static void checkPositive(List<ConfigurationError> errors, String componentName, String parameter, double value) {
        if (!(value > 0)) {
            errors.add(new ConfigurationError(componentName, parameter, "must be strictly positive: " + value));
        }
    }

    @Override
    public String toString() {
        return getType() + "(" + name + ")";
    }
}
