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

import com.hellblazer.qnet.kernel.Timeline;
import com.hellblazer.qnet.network.Message;
import com.hellblazer.qnet.network.Node;
import com.hellblazer.qnet.resource.hardware.DefaultHardware;
import com.hellblazer.qnet.resource.hardware.Hardware;
import com.hellblazer.qnet.resource.hardware.HardwareConfig;
import com.hellblazer.qnet.resource.memory.MemoryArray;
import com.hellblazer.qnet.resource.memory.MemoryManager;
import com.hellblazer.qnet.resource.rule.Rule;

import java.util.HashMap;
import java.util.Map;

/**
 * A node with a quantum memory array, managed by a {@link ResourceManager}.
 *
 * @author hal.hildebrand
 */
public class QuantumRouter extends Node {

    private final Hardware             hardware;
    private final MemoryManager        memoryManager;
    private final ResourceManager      resourceManager;
    private final Map<String, Integer> protocolCounters = new HashMap<>();

    public QuantumRouter(String name, Timeline timeline) {
        this(name, timeline, HardwareConfig.defaultConfig(), ResourceManagerConfig.defaultConfig());
    }

    public QuantumRouter(String name, Timeline timeline, HardwareConfig hardware, ResourceManagerConfig config) {
        this(name, timeline, new DefaultHardware(name, hardware), config);
    }

    public QuantumRouter(String name, Timeline timeline, Hardware hardware, ResourceManagerConfig config) {
        super(name, timeline);
        this.hardware = hardware;
        this.memoryManager = new MemoryManager(new MemoryArray(name, hardware.memorySize(), hardware.rawFidelity()));
        this.resourceManager = new ResourceManager(this, memoryManager, config);
    }

    /**
     * @return a name unique within this router, e.g. {@code EG[3]#17}
     */
    public String nextProtocolName(String prefix) {
        int next = protocolCounters.merge(prefix, 1, Integer::sum);
        return prefix + "#" + next;
    }

    public void load(Rule rule) {
        resourceManager.load(rule);
    }

    public void expire(Rule rule) {
        resourceManager.expire(rule);
    }

    @Override
    protected void receivedByResourceManager(String src, Message msg) {
        resourceManager.receivedMessage(src, msg);
    }

    public Hardware getHardware() {
        return hardware;
    }

    public MemoryManager getMemoryManager() {
        return memoryManager;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }
}
