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

import java.util.Random;

/**
 * {@link Hardware} backed by a {@link HardwareConfig}. Each router draws from its own random stream, seeded from the
 * configured seed and the router name, so runs are reproducible regardless of how many routers share the seed.
 * <p>
 * Certain outcomes (probability 0 or 1) do not consume randomness.
 *
 * @author hal.hildebrand
 */
public class DefaultHardware implements Hardware {

    private final HardwareConfig config;
    private final Random         entropy;

    public DefaultHardware(String node, HardwareConfig config) {
        this(config, new Random(config.getSeed() * 31 + node.hashCode()));
    }

    public DefaultHardware(HardwareConfig config, Random entropy) {
        this.config = config;
        this.entropy = entropy;
    }

    @Override
    public int memorySize() {
        return config.getMemorySize();
    }

    @Override
    public double rawFidelity() {
        return config.getRawFidelity();
    }

    @Override
    public long coherenceTime() {
        return config.getCoherenceTime();
    }

    @Override
    public long delay(DelayKind kind) {
        return switch (kind) {
            case GENERATION_ATTEMPT -> config.getAttemptDelay();
            case PURIFICATION -> config.getPurificationDelay();
            case SWAPPING -> config.getSwappingDelay();
        };
    }

    @Override
    public double generationSuccessProbability(String peer) {
        return config.getGenerationProbability(peer);
    }

    @Override
    public boolean drawSuccess(double probability) {
        if (probability >= 1.0) {
            return true;
        }
        if (probability <= 0.0) {
            return false;
        }
        return entropy.nextDouble() < probability;
    }

    public HardwareConfig getConfig() {
        return config;
    }
}
