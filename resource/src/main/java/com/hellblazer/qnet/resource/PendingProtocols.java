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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Protocols that wait for a peer's request, indexed by name and by the memory slots they own.
 * <p>
 * Matchers only read this table. The resource manager applies the chosen {@link Match} afterwards, removing (or
 * merging) entries in one step, so the table is never modified while a matcher traverses it.
 *
 * @author hal.hildebrand
 */
public class PendingProtocols {

    private final Map<String, EntanglementProtocol>  byName   = new LinkedHashMap<>();
    private final Map<Integer, EntanglementProtocol> byMemory = new HashMap<>();

    /**
     * @return pending protocols of the kind, oldest first
     */
    public List<EntanglementProtocol> ofKind(ProtocolKind kind) {
        var result = new ArrayList<EntanglementProtocol>();
        for (var protocol : byName.values()) {
            if (protocol.kind() == kind) {
                result.add(protocol);
            }
        }
        return result;
    }

    /**
     * @return the pending protocol owning the slot, or null
     */
    public EntanglementProtocol byMemory(int index) {
        return byMemory.get(index);
    }

    public EntanglementProtocol get(String name) {
        return byName.get(name);
    }

    public boolean contains(EntanglementProtocol protocol) {
        return byName.get(protocol.getName()) == protocol;
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    void add(EntanglementProtocol protocol) {
        if (byName.putIfAbsent(protocol.getName(), protocol) != null) {
            throw new IllegalStateException("Duplicate pending protocol: " + protocol.getName());
        }
        for (var index : protocol.getMemoryIndices()) {
            byMemory.put(index, protocol);
        }
    }

    boolean remove(EntanglementProtocol protocol) {
        if (!contains(protocol)) {
            return false;
        }
        byName.remove(protocol.getName());
        for (var index : protocol.getMemoryIndices()) {
            byMemory.remove(index, protocol);
        }
        return true;
    }
}
