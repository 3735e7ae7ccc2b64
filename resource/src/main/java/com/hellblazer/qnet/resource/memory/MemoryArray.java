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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fixed set of quantum memories of one node, indexed by slot.
 *
 * @author hal.hildebrand
 */
public class MemoryArray {

    private final String             node;
    private final List<QuantumMemory> memories;

    public MemoryArray(String node, int size, double rawFidelity) {
        if (size < 0) {
            throw new IllegalArgumentException("Memory array size must be non-negative: " + size);
        }
        this.node = node;
        var list = new ArrayList<QuantumMemory>(size);
        for (int i = 0; i < size; i++) {
            list.add(new QuantumMemory(new MemoryId(node, i), rawFidelity));
        }
        this.memories = Collections.unmodifiableList(list);
    }

    public QuantumMemory get(int index) {
        if (index < 0 || index >= memories.size()) {
            throw new IndexOutOfBoundsException(node + " has no memory " + index);
        }
        return memories.get(index);
    }

    public int size() {
        return memories.size();
    }

    public String getNode() {
        return node;
    }

    public List<QuantumMemory> getMemories() {
        return memories;
    }
}
