/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

/**
 * Equations of a component have been requested while one of its ports is not connected.
 */
public class PortNotConnectedException extends ConfigurationException {

    private final String componentName;

    private final String port;

    public PortNotConnectedException(String componentName, String port, boolean inlet) {
        super(new ConfigurationError(componentName, (inlet ? "inlet '" : "outlet '") + port + "'", "is not connected"));
        this.componentName = componentName;
        this.port = port;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getPort() {
        return port;
    }
}
