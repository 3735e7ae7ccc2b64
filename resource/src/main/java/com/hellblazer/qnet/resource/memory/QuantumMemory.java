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
 * Physical state of a single quantum memory: whether it currently holds half of an entangled pair, with whom, and at
 * what fidelity.
 * <p>
 * The version increments whenever the memory is entangled or reset, so deferred actions (expiry for instance) can
 * detect that the pair they were scheduled for no longer exists.
 *
 * @author hal.hildebrand
 */
public class QuantumMemory {

    private final MemoryId id;
    private final double   rawFidelity;
    private       MemoryId entangled;
    private       double   fidelity;
    private       long     entangleTime = -1;
    private       long     version;

    /**
     * @param id          this memory's identity
     * @param rawFidelity fidelity of freshly generated pairs
     */
    public QuantumMemory(MemoryId id, double rawFidelity) {
        if (rawFidelity < 0.0 || rawFidelity > 1.0) {
            throw new IllegalArgumentException("Raw fidelity out of range: " + rawFidelity);
        }
        this.id = id;
        this.rawFidelity = rawFidelity;
    }

    /**
     * Record a new entangled pair.
     *
     * @param remote   partner memory
     * @param fidelity pair fidelity
     * @param time     time the pair was established
     */
    public void entangle(MemoryId remote, double fidelity, long time) {
        if (remote == null) {
            throw new IllegalArgumentException("Remote memory required");
        }
        if (fidelity < 0.0 || fidelity > 1.0) {
            throw new IllegalArgumentException("Fidelity out of range: " + fidelity);
        }
        this.entangled = remote;
        this.fidelity = fidelity;
        this.entangleTime = time;
        version++;
    }

    /**
     * Change the fidelity of the current pair, as purification does.
     */
    public void setFidelity(double fidelity) {
        if (entangled == null) {
            throw new IllegalStateException(id + " is not entangled");
        }
        if (fidelity < 0.0 || fidelity > 1.0) {
            throw new IllegalArgumentException("Fidelity out of range: " + fidelity);
        }
        this.fidelity = fidelity;
    }

    /**
     * Discard any pair held by this memory.
     */
    public void reset() {
        entangled = null;
        fidelity = 0.0;
        entangleTime = -1;
        version++;
    }

    public boolean isEntangled() {
        return entangled != null;
    }

    public MemoryId getId() {
        return id;
    }

    public int getIndex() {
        return id.index();
    }

    public MemoryId getEntangled() {
        return entangled;
    }

    public double getFidelity() {
        return fidelity;
    }

    public double getRawFidelity() {
        return rawFidelity;
    }

    public long getEntangleTime() {
        return entangleTime;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return String.format("QuantumMemory{%s, entangled=%s, fidelity=%.4f}", id, entangled, fidelity);
    }
}
