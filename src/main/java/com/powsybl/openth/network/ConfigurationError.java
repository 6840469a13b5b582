/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.network;

import java.util.Objects;

/**
 * A configuration problem found before solving.
 *
 * @param elementName name of the component or connection at fault
 * @param subject port or parameter name
 * @param reason what is wrong
 */
public record ConfigurationError(String elementName, String subject, String reason) {

    public ConfigurationError {
        Objects.requireNonNull(elementName);
        Objects.requireNonNull(subject);
        Objects.requireNonNull(reason);
    }

    @Override
    public String toString() {
        return elementName + ": " + subject + " " + reason;
    }
}
