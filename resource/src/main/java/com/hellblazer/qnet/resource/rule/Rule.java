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
package com.hellblazer.qnet.resource.rule;

import com.hellblazer.qnet.resource.EntanglementProtocol;
import com.hellblazer.qnet.resource.QuantumRouter;
import com.hellblazer.qnet.resource.memory.MemoryInfo;
import com.hellblazer.qnet.resource.memory.MemoryManager;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A prioritized condition/action pair installed on a router. Tracks the protocols it spawned so that expiring the
 * rule can tear them down.
 *
 * @author hal.hildebrand
 */
public class Rule {

    private final int                       priority;
    private final RuleCondition             condition;
    private final RuleAction                action;
    private final Set<EntanglementProtocol> protocols = new LinkedHashSet<>();
    private       long                      sequence  = -1;

    /**
     * @param priority  higher priorities are evaluated first
     * @param condition selects memories
     * @param action    creates the protocol for selected memories
     */
    public Rule(int priority, RuleCondition condition, RuleAction action) {
        if (condition == null || action == null) {
            throw new IllegalArgumentException("Condition and action are required");
        }
        this.priority = priority;
        this.condition = condition;
        this.action = action;
    }

    public List<MemoryInfo> evaluate(MemoryInfo memory, MemoryManager manager) {
        var matched = condition.evaluate(memory, manager);
        return matched == null ? List.of() : matched;
    }

    public ActionResult apply(List<MemoryInfo> memories, QuantumRouter router) {
        return action.apply(memories, router);
    }

    public int getPriority() {
        return priority;
    }

    public RuleCondition getCondition() {
        return condition;
    }

    public RuleAction getAction() {
        return action;
    }

    /**
     * @return installation order, assigned by the {@link RuleManager}; -1 when not installed
     */
    public long getSequence() {
        return sequence;
    }

    void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void addProtocol(EntanglementProtocol protocol) {
        protocols.add(protocol);
    }

    public boolean removeProtocol(EntanglementProtocol protocol) {
        return protocols.remove(protocol);
    }

    /**
     * Substitute a protocol in place, as when two pending protocols merge into one.
     */
    public void replaceProtocol(EntanglementProtocol existing, EntanglementProtocol replacement) {
        protocols.remove(existing);
        protocols.add(replacement);
    }

    /**
     * @return a copy of the spawned protocols that have not yet been released
     */
    public List<EntanglementProtocol> getProtocols() {
        return new ArrayList<>(protocols);
    }

    @Override
    public String toString() {
        return String.format("Rule{priority=%d, seq=%d, condition=%s, protocols=%d}", priority, sequence, condition,
                             protocols.size());
    }
}
