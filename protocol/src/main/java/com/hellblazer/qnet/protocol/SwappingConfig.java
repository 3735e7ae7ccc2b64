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
package com.hellblazer.qnet.protocol;

/**
 * Physical parameters of entanglement swapping.
 *
 * @author hal.hildebrand
 */
public class SwappingConfig {

    private final double successProbability;
    private final double degradation;

    private SwappingConfig(Builder builder) {
        this.successProbability = builder.successProbability;
        this.degradation = builder.degradation;
    }

    public double getSuccessProbability() {
        return successProbability;
    }

    /**
     * @return factor applied to the product of the consumed fidelities
     */
    public double getDegradation() {
        return degradation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Certain swaps with a degradation of 0.95.
     */
    public static SwappingConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Builder class for SwappingConfig
     */
    public static class Builder {
        private double successProbability = 1.0;
        private double degradation        = 0.95;

        private Builder() {
        }

        public Builder withSuccessProbability(double successProbability) {
            if (successProbability < 0.0 || successProbability > 1.0 || Double.isNaN(successProbability)) {
                throw new IllegalArgumentException("Success probability must be within [0, 1]: " + successProbability);
            }
            this.successProbability = successProbability;
            return this;
        }

        public Builder withDegradation(double degradation) {
            if (degradation <= 0.0 || degradation > 1.0 || Double.isNaN(degradation)) {
                throw new IllegalArgumentException("Degradation must be within (0, 1]: " + degradation);
            }
            this.degradation = degradation;
            return this;
        }

        public SwappingConfig build() {
            return new SwappingConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("SwappingConfig[successProbability=%.3f, degradation=%.3f]", successProbability,
                             degradation);
    }
}
