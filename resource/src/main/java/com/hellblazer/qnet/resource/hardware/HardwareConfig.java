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

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration of a router's hardware: memory array, physical step durations, generation odds and random seed.
 *
 * @author hal.hildebrand
 */
public class HardwareConfig {

    private final int                 memorySize;
    private final double              rawFidelity;
    private final long                coherenceTime;
    private final long                attemptDelay;
    private final long                purificationDelay;
    private final long                swappingDelay;
    private final double              generationProbability;
    private final Map<String, Double> peerGenerationProbability;
    private final long                seed;

    private HardwareConfig(Builder builder) {
        this.memorySize = builder.memorySize;
        this.rawFidelity = builder.rawFidelity;
        this.coherenceTime = builder.coherenceTime;
        this.attemptDelay = builder.attemptDelay;
        this.purificationDelay = builder.purificationDelay;
        this.swappingDelay = builder.swappingDelay;
        this.generationProbability = builder.generationProbability;
        this.peerGenerationProbability = Map.copyOf(builder.peerGenerationProbability);
        this.seed = builder.seed;
    }

    public int getMemorySize() {
        return memorySize;
    }

    public double getRawFidelity() {
        return rawFidelity;
    }

    /**
     * @return coherence time in picoseconds; non-positive means memories never expire
     */
    public long getCoherenceTime() {
        return coherenceTime;
    }

    public long getAttemptDelay() {
        return attemptDelay;
    }

    public long getPurificationDelay() {
        return purificationDelay;
    }

    public long getSwappingDelay() {
        return swappingDelay;
    }

    /**
     * @return generation success probability toward the peer, falling back to the default probability
     */
    public double getGenerationProbability(String peer) {
        return peerGenerationProbability.getOrDefault(peer, generationProbability);
    }

    public double getGenerationProbability() {
        return generationProbability;
    }

    public long getSeed() {
        return seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Ten memories at fidelity 0.9 that never expire, 1 µs generation attempts that always succeed.
     */
    public static HardwareConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Builder class for HardwareConfig
     */
    public static class Builder {
        private final Map<String, Double> peerGenerationProbability = new HashMap<>();
        private       int                 memorySize                = 10;
        private       double              rawFidelity               = 0.9;
        private       long                coherenceTime             = -1;
        private       long                attemptDelay              = 1_000_000;
        private       long                purificationDelay         = 0;
        private       long                swappingDelay             = 0;
        private       double              generationProbability     = 1.0;
        private       long                seed                      = 0;

        private Builder() {
        }

        public Builder withMemorySize(int memorySize) {
            if (memorySize < 0) {
                throw new IllegalArgumentException("Memory size must be non-negative");
            }
            this.memorySize = memorySize;
            return this;
        }

        public Builder withRawFidelity(double rawFidelity) {
            checkProbability("Raw fidelity", rawFidelity);
            this.rawFidelity = rawFidelity;
            return this;
        }

        /**
         * @param coherenceTime picoseconds an entangled memory stays usable; non-positive disables expiry
         */
        public Builder withCoherenceTime(long coherenceTime) {
            this.coherenceTime = coherenceTime;
            return this;
        }

        /**
         * @throws IllegalArgumentException unless the delay is positive
         */
        public Builder withAttemptDelay(long attemptDelay) {
            if (attemptDelay <= 0) {
                throw new IllegalArgumentException("Attempt delay must be positive");
            }
            this.attemptDelay = attemptDelay;
            return this;
        }

        public Builder withPurificationDelay(long purificationDelay) {
            if (purificationDelay < 0) {
                throw new IllegalArgumentException("Purification delay must be non-negative");
            }
            this.purificationDelay = purificationDelay;
            return this;
        }

        public Builder withSwappingDelay(long swappingDelay) {
            if (swappingDelay < 0) {
                throw new IllegalArgumentException("Swapping delay must be non-negative");
            }
            this.swappingDelay = swappingDelay;
            return this;
        }

        public Builder withGenerationProbability(double probability) {
            checkProbability("Generation probability", probability);
            this.generationProbability = probability;
            return this;
        }

        /**
         * Override the generation probability for one link.
         */
        public Builder withGenerationProbability(String peer, double probability) {
            checkProbability("Generation probability", probability);
            peerGenerationProbability.put(peer, probability);
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public HardwareConfig build() {
            return new HardwareConfig(this);
        }

        private static void checkProbability(String what, double value) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(what + " must be within [0, 1]: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return String.format(
            "HardwareConfig[memories=%d, rawFidelity=%.3f, coherence=%d, attemptDelay=%d, generationProbability=%.3f, seed=%d]",
            memorySize, rawFidelity, coherenceTime, attemptDelay, generationProbability, seed);
    }
}
