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
package com.hellblazer.qnet.resource.memory;

/**
 * Name based reference to a memory slot on some node. Nodes refer to each other's memories only through these.
 *
 * @param node  node name
 * @param index slot index on that node
 * @author hal.hildebrand
 */
public record MemoryId(String node, int index) {

    public MemoryId {
        if (node == null || node.isEmpty()) {
            throw new IllegalArgumentException("Node name required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
    }

    @Override
    public String toString() {
        return node + "[" + index + "]";
    }
}
