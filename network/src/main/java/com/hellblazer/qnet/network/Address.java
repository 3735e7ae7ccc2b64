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
package com.hellblazer.qnet.network;

/**
 * Addressee of a {@link Message} within the destination node.
 *
 * @author hal.hildebrand
 */
public sealed interface Address permits Address.ProtocolAddress, Address.ResourceManagerAddress, Address.Broadcast {

    ResourceManagerAddress RESOURCE_MANAGER = new ResourceManagerAddress();

    static Address protocol(String name) {
        return new ProtocolAddress(name);
    }

    static Address resourceManager() {
        return RESOURCE_MANAGER;
    }

    static Address broadcast(String kind) {
        return new Broadcast(kind);
    }

    /**
     * A single protocol instance, by its node-unique name.
     *
     * @param name protocol name
     */
    record ProtocolAddress(String name) implements Address {
        public ProtocolAddress {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Protocol name required");
            }
        }
    }

    /**
     * The node's resource manager.
     */
    record ResourceManagerAddress() implements Address {
    }

    /**
     * Every active protocol of the given kind.
     *
     * @param kind protocol kind tag
     */
    record Broadcast(String kind) implements Address {
    }
}
