/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openth.equations.Equation;
import com.powsybl.openth.equations.Variable;
import com.powsybl.openth.props.FluidProperties;
import com.powsybl.openth.solver.NewtonRaphson;
import com.powsybl.openth.solver.NewtonRaphsonParameters;
import com.powsybl.openth.solver.NewtonRaphsonResult;

import java.util.*;

/**
 * Components connected by directed connections. The network only aggregates: variables are listed connection by
 * connection in insertion order, then component by component, and equations component by component.
 */
public class Network {

    private final FluidProperties props;

    private final Map<String, Component> componentsByName = new LinkedHashMap<>();

    private final Map<String, Connection> connectionsByName = new LinkedHashMap<>();

    public Network(FluidProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public FluidProperties getProps() {
        return props;
    }

    public <T extends Component> T addComponent(T component) {
        Objects.requireNonNull(component);
        if (componentsByName.containsKey(component.getName())) {
            throw new ConfigurationException(new ConfigurationError(component.getName(), "name", "is already used by another component"));
        }
        componentsByName.put(component.getName(), component);
        return component;
    }

    public Connection addConnection(Connection connection) {
        Objects.requireNonNull(connection);
        if (connectionsByName.containsKey(connection.getName())) {
            throw new ConfigurationException(new ConfigurationError(connection.getName(), "name", "is already used by another connection"));
        }
        connectionsByName.put(connection.getName(), connection);
        return connection;
    }

    /**
     * Create a connection from an outlet port of a component to an inlet port of another one.
     */
    public Connection connect(Component source, String sourcePort, Component destination, String destinationPort,
                              String name, double mGuess, double pGuess, double hGuess) {
        checkComponent(source);
        checkComponent(destination);
        Connection connection = addConnection(Connection.create(name, mGuess, pGuess, hGuess));
        source.connectOutlet(sourcePort, connection);
        destination.connectInlet(destinationPort, connection);
        return connection;
    }

    private void checkComponent(Component component) {
        Objects.requireNonNull(component);
        if (componentsByName.get(component.getName()) != component) {
            throw new ConfigurationException(new ConfigurationError(component.getName(), "component", "does not belong to the network"));
        }
    }

    public Collection<Component> getComponents() {
        return Collections.unmodifiableCollection(componentsByName.values());
    }

    public Optional<Component> getComponent(String name) {
        return Optional.ofNullable(componentsByName.get(name));
    }

    public Collection<Connection> getConnections() {
        return Collections.unmodifiableCollection(connectionsByName.values());
    }

    public Optional<Connection> getConnection(String name) {
        return Optional.ofNullable(connectionsByName.get(name));
    }

    public List<Variable> getVariables() {
        List<Variable> variables = new ArrayList<>(connectionsByName.size() * 3);
        for (Connection connection : connectionsByName.values()) {
            variables.addAll(connection.getVariables());
        }
        for (Component component : componentsByName.values()) {
            variables.addAll(component.getVariables());
        }
        return variables;
    }

    public List<Variable> getFreeVariables() {
        return getVariables().stream()
                .filter(v -> !v.isFixed())
                .toList();
    }

    public List<Equation> getEquations() {
        List<Equation> equations = new ArrayList<>();
        for (Component component : componentsByName.values()) {
            equations.addAll(component.equations(props));
        }
        return equations;
    }

    /**
     * Check every component and the topology: each connection must have exactly one producer and one consumer.
     */
    public List<ConfigurationError> validate() {
        List<ConfigurationError> errors = new ArrayList<>();
        Map<Connection, Integer> producerCount = new IdentityHashMap<>();
        Map<Connection, Integer> consumerCount = new IdentityHashMap<>();
        for (Component component : componentsByName.values()) {
            errors.addAll(component.validate());
            component.getOutlets().values().forEach(c -> producerCount.merge(c, 1, Integer::sum));
            component.getInlets().values().forEach(c -> consumerCount.merge(c, 1, Integer::sum));
        }
        for (Connection connection : connectionsByName.values()) {
            checkEndCount(errors, connection, "producer", producerCount.getOrDefault(connection, 0));
            checkEndCount(errors, connection, "consumer", consumerCount.getOrDefault(connection, 0));
        }
        return errors;
    }

    private static void checkEndCount(List<ConfigurationError> errors, Connection connection, String end, int count) {
        if (count != 1) {
            errors.add(new ConfigurationError(connection.getName(), end, "count must be 1, found " + count));
        }
    }

    public NewtonRaphsonResult solve() {
        return solve(new NewtonRaphsonParameters());
    }

    public NewtonRaphsonResult solve(NewtonRaphsonParameters parameters) {
        return solve(parameters, ReportNode.NO_OP);
    }

    public NewtonRaphsonResult solve(NewtonRaphsonParameters parameters, ReportNode reportNode) {
        return new NewtonRaphson(this, parameters).run(reportNode);
    }
}
