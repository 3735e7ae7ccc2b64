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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of the {@link MemoryInfo} records of one node, one per slot of its {@link MemoryArray}.
 * <p>
 * Records are immutable and replaced wholesale on every state change, so a reader always observes a complete record
 * for each slot. ENTANGLED records are derived from the physical memory at the moment of the change.
 * <p>
 * Usage:
 * <pre>
 * var manager = new MemoryManager(array);
 * manager.setState(3, MemoryState.OCCUPIED);
 * for (var info : manager.iterate()) {
 *     if (info.isEntangled()) {
 *         report(info.remote(), info.fidelity());
 *     }
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class MemoryManager {

    private final MemoryArray          array;
    private final MemoryInfo[]         infos;
    private final List<MemoryObserver> observers = new CopyOnWriteArrayList<>();

    public MemoryManager(MemoryArray array) {
        this.array = array;
        this.infos = new MemoryInfo[array.size()];
        for (int i = 0; i < infos.length; i++) {
            infos[i] = MemoryInfo.raw(i);
        }
    }

    /**
     * @return the current record of the slot
     */
    public MemoryInfo get(int index) {
        checkIndex(index);
        return infos[index];
    }

    /**
     * @return the physical memory of the slot
     */
    public QuantumMemory getMemory(int index) {
        return array.get(index);
    }

    public MemoryArray getArray() {
        return array;
    }

    public int size() {
        return infos.length;
    }

    /**
     * Lazy, restartable view of the records in index order. Each iteration reads the records current at the time
     * each element is produced.
     */
    public Iterable<MemoryInfo> iterate() {
        return () -> new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < infos.length;
            }

            @Override
            public MemoryInfo next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return infos[next++];
            }
        };
    }

    /**
     * @return a copy of every record, in index order
     */
    public List<MemoryInfo> snapshot() {
        return List.of(infos.clone());
    }

    public int count(MemoryState state) {
        int count = 0;
        for (var info : infos) {
            if (info.state() == state) {
                count++;
            }
        }
        return count;
    }

    /**
     * Replace the record of a slot.
     * <p>
     * RAW and OCCUPIED clear the entanglement fields. ENTANGLED copies the partner, fidelity and entangle time from
     * the physical memory, which must hold a pair.
     *
     * @return the new record
     * @throws IllegalStateException if ENTANGLED is requested for a memory holding no pair
     */
    public MemoryInfo setState(int index, MemoryState state) {
        checkIndex(index);
        var memory = array.get(index);
        MemoryInfo updated;
        switch (state) {
            case RAW -> updated = MemoryInfo.raw(index);
            case OCCUPIED -> updated = MemoryInfo.occupied(index);
            case ENTANGLED -> {
                if (!memory.isEntangled()) {
                    throw new IllegalStateException(memory.getId() + " holds no entangled pair");
                }
                updated = MemoryInfo.entangled(index, memory.getEntangled(), memory.getFidelity(),
                                               memory.getEntangleTime());
            }
            default -> throw new IllegalArgumentException("Unknown state: " + state);
        }
        var previous = infos[index];
        infos[index] = updated;
        for (var observer : observers) {
            observer.memoryUpdated(previous, updated);
        }
        return updated;
    }

    public void addObserver(MemoryObserver observer) {
        observers.add(observer);
    }

    public void removeObserver(MemoryObserver observer) {
        observers.remove(observer);
    }

    /**
     * @return indices of the slots in the given state
     */
    public List<Integer> indicesOf(MemoryState state) {
        var result = new ArrayList<Integer>();
        for (var info : infos) {
            if (info.state() == state) {
                result.add(info.index());
            }
        }
        return result;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= infos.length) {
            throw new IndexOutOfBoundsException(array.getNode() + " has no memory " + index);
        }
    }

    @Override
    public String toString() {
        return String.format("MemoryManager{%s, raw=%d, occupied=%d, entangled=%d}", array.getNode(),
                             count(MemoryState.RAW), count(MemoryState.OCCUPIED), count(MemoryState.ENTANGLED));
    }
}
