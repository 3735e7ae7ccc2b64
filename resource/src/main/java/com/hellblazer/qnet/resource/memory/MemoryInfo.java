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
 * Immutable snapshot of one memory slot as seen by the resource manager.
 * <p>
 * The remote reference, fidelity and entangle time are defined iff the state is {@link MemoryState#ENTANGLED};
 * RAW and OCCUPIED records carry no remote reference and zero fidelity.
 *
 * @param index        stable slot index
 * @param state        resource state
 * @param remote       partner memory, or null unless entangled
 * @param fidelity     pair fidelity in [0, 1], zero unless entangled
 * @param entangleTime time the pair was established, -1 unless entangled
 * @author hal.hildebrand
 */
public record MemoryInfo(int index, MemoryState state, MemoryId remote, double fidelity, long entangleTime) {

    public MemoryInfo {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
        if (state == null) {
            throw new IllegalArgumentException("State required");
        }
        if (state == MemoryState.ENTANGLED) {
            if (remote == null) {
                throw new IllegalArgumentException("Entangled memory " + index + " requires a remote memory");
            }
            if (fidelity < 0.0 || fidelity > 1.0) {
                throw new IllegalArgumentException("Fidelity out of range: " + fidelity);
            }
        } else if (remote != null || fidelity != 0.0) {
            throw new IllegalArgumentException(state + " memory " + index + " cannot carry entanglement fields");
        }
    }

    public static MemoryInfo raw(int index) {
        return new MemoryInfo(index, MemoryState.RAW, null, 0.0, -1);
    }

    public static MemoryInfo occupied(int index) {
        return new MemoryInfo(index, MemoryState.OCCUPIED, null, 0.0, -1);
    }

    public static MemoryInfo entangled(int index, MemoryId remote, double fidelity, long entangleTime) {
        return new MemoryInfo(index, MemoryState.ENTANGLED, remote, fidelity, entangleTime);
    }

    /**
     * @return partner node name, or null unless entangled
     */
    public String remoteNode() {
        return remote == null ? null : remote.node();
    }

    /**
     * @return partner slot index, or -1 unless entangled
     */
    public int remoteMemo() {
        return remote == null ? -1 : remote.index();
    }

    public boolean isEntangled() {
        return state == MemoryState.ENTANGLED;
    }
}
