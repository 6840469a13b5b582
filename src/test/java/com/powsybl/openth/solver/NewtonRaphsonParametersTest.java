/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openth.solver;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Defaults, platform configuration loading and range checks of the solver parameters.
 */
class NewtonRaphsonParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    public void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    public void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaults() {
        NewtonRaphsonParameters parameters = new NewtonRaphsonParameters();
        assertEquals(60, parameters.getMaxIterations());
        assertEquals(1e-7, parameters.getResidualTolerance());
        assertEquals(1e-9, parameters.getStepTolerance());
        assertEquals(1e-6, parameters.getFiniteDifferenceStep());
        assertTrue(parameters.isDampingEnabled());
        assertEquals(StateVectorScalingMode.LINE_SEARCH, parameters.getStateVectorScalingMode());
        assertEquals(DiagnosticsVerbosity.SUMMARY, parameters.getDiagnosticsVerbosity());
        assertEquals(StoppingCriteriaType.RESIDUAL_NORM, parameters.getStoppingCriteriaType());
        assertEquals(14, parameters.getLineSearchMaxIterations());
        assertEquals(2, parameters.getLineSearchStepFold());
        assertEquals(5, parameters.getWorstResidualCount());
        assertInstanceOf(DefaultNewtonRaphsonStoppingCriteria.class, parameters.createStoppingCriteria());
    }

    @Test
    void testNoModuleConfig() {
        NewtonRaphsonParameters parameters = NewtonRaphsonParameters.load(platformConfig);
        assertEquals(new NewtonRaphsonParameters().toString(), parameters.toString());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(NewtonRaphsonParameters.MODULE_NAME);
        moduleConfig.setStringProperty("maxIterations", "25");
        moduleConfig.setStringProperty("residualTolerance", "1e-6");
        moduleConfig.setStringProperty("dampingEnabled", "false");
        moduleConfig.setStringProperty("diagnosticsVerbosity", "DETAILED");
        moduleConfig.setStringProperty("stoppingCriteriaType", "PER_EQUATION");
        moduleConfig.setStringProperty("lineSearchStepFold", "3");

        NewtonRaphsonParameters parameters = NewtonRaphsonParameters.load(platformConfig);
        assertEquals(25, parameters.getMaxIterations());
        assertEquals(1e-6, parameters.getResidualTolerance());
        assertFalse(parameters.isDampingEnabled());
        assertEquals(StateVectorScalingMode.NONE, parameters.getStateVectorScalingMode());
        assertEquals(DiagnosticsVerbosity.DETAILED, parameters.getDiagnosticsVerbosity());
        assertEquals(StoppingCriteriaType.PER_EQUATION, parameters.getStoppingCriteriaType());
        assertInstanceOf(PerEquationStoppingCriteria.class, parameters.createStoppingCriteria());
        assertEquals(3, parameters.getLineSearchStepFold());
        // untouched
        assertEquals(1e-6, parameters.getFiniteDifferenceStep());
        assertEquals(14, parameters.getLineSearchMaxIterations());
    }

    @Test
    void testUpdateFromMap() {
        NewtonRaphsonParameters parameters = NewtonRaphsonParameters.load(Map.of(
                "maxIterations", "10",
                "stepTolerance", "0",
                "finiteDifferenceStep", "1e-7",
                "lineSearchMaxIterations", "5",
                "worstResidualCount", "0"));
        assertEquals(10, parameters.getMaxIterations());
        assertEquals(0, parameters.getStepTolerance());
        assertEquals(1e-7, parameters.getFiniteDifferenceStep());
        assertEquals(5, parameters.getLineSearchMaxIterations());
        assertEquals(0, parameters.getWorstResidualCount());

        parameters.update(Map.of("residualTolerance", "1e-9"));
        assertEquals(1e-9, parameters.getResidualTolerance());
        assertEquals(10, parameters.getMaxIterations());
    }

    @Test
    void testInvalidValues() {
        NewtonRaphsonParameters parameters = new NewtonRaphsonParameters();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parameters.setMaxIterations(0));
        assertEquals("Invalid max iteration value: 0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parameters.setResidualTolerance(0));
        assertThrows(IllegalArgumentException.class, () -> parameters.setResidualTolerance(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> parameters.setStepTolerance(-1));
        assertThrows(IllegalArgumentException.class, () -> parameters.setFiniteDifferenceStep(0));
        assertThrows(IllegalArgumentException.class, () -> parameters.setLineSearchMaxIterations(0));
        assertThrows(IllegalArgumentException.class, () -> parameters.setLineSearchStepFold(1));
        assertThrows(IllegalArgumentException.class, () -> parameters.setWorstResidualCount(-1));
        assertThrows(NullPointerException.class, () -> parameters.setDiagnosticsVerbosity(null));
        Map<String, String> properties = Map.of("diagnosticsVerbosity", "VERBOSE");
        assertThrows(IllegalArgumentException.class, () -> parameters.update(properties));
    }

    @Test
    void testToString() {
        assertEquals("NewtonRaphsonParameters(maxIterations=60, residualTolerance=1.0E-7, stepTolerance=1.0E-9, " +
                     "finiteDifferenceStep=1.0E-6, dampingEnabled=true, diagnosticsVerbosity=SUMMARY, " +
                     "stoppingCriteriaType=RESIDUAL_NORM, lineSearchMaxIterations=14, lineSearchStepFold=2.0, " +
                     "worstResidualCount=5)",
                     new NewtonRaphsonParameters().toString());
    }
}
