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
package com.hellblazer.qnet.protocol.rules;

import com.hellblazer.qnet.protocol.SwappingConfig;
import com.hellblazer.qnet.resource.rule.Rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for the standard rules of a link or path reservation.
 * <p>
 * A link between two routers is served by a generation rule on each side, exactly one of which initiates. The same
 * holds for purification. A path through an intermediate router swaps with {@link #swappingA} on the intermediate
 * router and {@link #swappingB} on both ends.
 *
 * @author hal.hildebrand
 */
public final class RuleTemplates {

    private RuleTemplates() {
    }

    /**
     * @return the slot indices from (inclusive) to (exclusive)
     */
    public static List<Integer> range(int from, int to) {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException(String.format("Invalid range [%d, %d)", from, to));
        }
        var indices = new ArrayList<Integer>(to - from);
        for (int i = from; i < to; i++) {
            indices.add(i);
        }
        return indices;
    }

    public static Rule generation(int priority, List<Integer> memories, String peer, boolean initiator) {
        return new Rule(priority, new GenerationCondition(memories), new GenerationAction(peer, initiator));
    }

    public static Rule purification(int priority, List<Integer> memories, double targetFidelity,
                                    boolean initiator) {
        var condition = initiator ? new PurificationCondition(memories, targetFidelity)
                                  : new PurificationResponderCondition(memories, targetFidelity);
        return new Rule(priority, condition, new PurificationAction(initiator));
    }

    public static Rule swappingA(int priority, List<Integer> memories, String leftNode, String rightNode,
                                 double minFidelity, SwappingConfig config) {
        return new Rule(priority, new SwappingACondition(memories, leftNode, rightNode, minFidelity),
                        new SwappingAAction(config));
    }

    public static Rule swappingB(int priority, List<Integer> memories, String middleNode, double minFidelity) {
        return new Rule(priority, new SwappingBCondition(memories, middleNode, minFidelity), new SwappingBAction());
    }
}
