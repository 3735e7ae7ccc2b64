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
package com.hellblazer.qnet.resource;

/**
 * Configuration of a router's resource manager.
 *
 * @author hal.hildebrand
 */
public class ResourceManagerConfig {

    private final long negotiationTimeout;

    private ResourceManagerConfig(Builder builder) {
        this.negotiationTimeout = builder.negotiationTimeout;
    }

    /**
     * @return picoseconds a requesting protocol waits for all responses before failing; non-positive waits forever
     */
    public long getNegotiationTimeout() {
        return negotiationTimeout;
    }

    public boolean isNegotiationTimeoutEnabled() {
        return negotiationTimeout > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Negotiations never time out.
     */
    public static ResourceManagerConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Builder class for ResourceManagerConfig
     */
    public static class Builder {
        private long negotiationTimeout = -1;

        private Builder() {
        }

        /**
         * @param timeout picoseconds to wait for responses
         * @throws IllegalArgumentException if timeout is not positive
         */
        public Builder withNegotiationTimeout(long timeout) {
            if (timeout <= 0) {
                throw new IllegalArgumentException("Negotiation timeout must be positive");
            }
            this.negotiationTimeout = timeout;
            return this;
        }

        public Builder withoutNegotiationTimeout() {
            this.negotiationTimeout = -1;
            return this;
        }

        public ResourceManagerConfig build() {
            return new ResourceManagerConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("ResourceManagerConfig[negotiationTimeout=%s]",
                             isNegotiationTimeoutEnabled() ? negotiationTimeout : "none");
    }
}
