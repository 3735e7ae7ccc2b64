/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the QNet.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.qnet.resource.hardware;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HardwareConfig and DefaultHardware.
 *
 * @author hal.hildebrand
 */
class HardwareConfigTest {

    @Test
    void testDefaultConfiguration() {
        var config = HardwareConfig.defaultConfig();
        assertEquals(10, config.getMemorySize());
        assertEquals(0.9, config.getRawFidelity());
        assertEquals(1_000_000, config.getAttemptDelay());
        assertEquals(1.0, config.getGenerationProbability());
        assertTrue(config.getCoherenceTime() <= 0);
    }

    @Test
    void testInvalidValuesRejected() {
        var builder = HardwareConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withMemorySize(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withRawFidelity(1.1));
        assertThrows(IllegalArgumentException.class, () -> builder.withAttemptDelay(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withPurificationDelay(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withSwappingDelay(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withGenerationProbability(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> builder.withGenerationProbability("bob", -0.1));
    }

    @Test
    void testPeerProbabilityOverridesDefault() {
        var config = HardwareConfig.builder()
                                   .withGenerationProbability(0.5)
                                   .withGenerationProbability("bob", 0.25)
                                   .build();
        var hardware = new DefaultHardware("alice", config);

        assertEquals(0.25, hardware.generationSuccessProbability("bob"));
        assertEquals(0.5, hardware.generationSuccessProbability("carol"));
    }

    @Test
    void testDelaysByKind() {
        var hardware = new DefaultHardware("alice", HardwareConfig.builder()
                                                                  .withAttemptDelay(7)
                                                                  .withPurificationDelay(11)
                                                                  .withSwappingDelay(13)
                                                                  .build());
        assertEquals(7, hardware.delay(DelayKind.GENERATION_ATTEMPT));
        assertEquals(11, hardware.delay(DelayKind.PURIFICATION));
        assertEquals(13, hardware.delay(DelayKind.SWAPPING));
    }

    @Test
    @DisplayName("Certain outcomes consume no randomness")
    void testCertainOutcomesDoNotDraw() {
        var config = HardwareConfig.defaultConfig();
        var drawn = new Random(3);
        var reference = new Random(3);
        var hardware = new DefaultHardware(config, drawn);

        assertTrue(hardware.drawSuccess(1.0));
        assertFalse(hardware.drawSuccess(0.0));

        assertEquals(reference.nextDouble(), drawn.nextDouble());
    }

    @Test
    @DisplayName("Same seed and router name reproduce the same draws")
    void testSeededDrawsAreReproducible() {
        var config = HardwareConfig.builder().withSeed(42).build();

        assertEquals(draws(new DefaultHardware("alice", config)), draws(new DefaultHardware("alice", config)));
        assertNotEquals(draws(new DefaultHardware("alice", config)), draws(new DefaultHardware("bob", config)));
    }

    private static List<Boolean> draws(Hardware hardware) {
        var outcomes = new ArrayList<Boolean>();
        for (int i = 0; i < 64; i++) {
            outcomes.add(hardware.drawSuccess(0.5));
        }
        return outcomes;
    }
}
