/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import com.powsybl.commons.PowsyblException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Network or component configuration is invalid. This is the only kind of failure the solver lets escape.
 */
public class ConfigurationException extends PowsyblException {

    private final transient List<ConfigurationError> errors;

    public ConfigurationException(ConfigurationError error) {
        this(List.of(error));
    }

    public ConfigurationException(List<ConfigurationError> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    private static String buildMessage(List<ConfigurationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one configuration error is expected");
        }
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.size() + " configuration errors: " + errors.stream()
                .map(ConfigurationError::toString)
                .collect(Collectors.joining("; "));
    }

    public List<ConfigurationError> getErrors() {
        return errors;
    }
}
