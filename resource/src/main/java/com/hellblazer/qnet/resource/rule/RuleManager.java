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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * The installed rules of one router, ordered by descending priority and then by installation order.
 * <p>
 * Iteration runs over a snapshot, so rules may be loaded or expired while a rule pass is underway.
 *
 * @author hal.hildebrand
 */
public class RuleManager implements Iterable<Rule> {

    private static final Comparator<Rule> ORDER = Comparator.comparingInt(Rule::getPriority)
                                                            .reversed()
                                                            .thenComparingLong(Rule::getSequence);

    private final List<Rule> rules = new ArrayList<>();
    private       long       sequence;

    /**
     * Install a rule.
     *
     * @throws RuleViolationException if the rule is already installed
     */
    public void load(Rule rule) {
        if (rules.contains(rule)) {
            throw new RuleViolationException("Rule already installed: " + rule);
        }
        rule.setSequence(sequence++);
        int position = 0;
        while (position < rules.size() && ORDER.compare(rules.get(position), rule) < 0) {
            position++;
        }
        rules.add(position, rule);
    }

    /**
     * Remove a rule.
     *
     * @return the protocols the rule spawned that are still tracked, for the caller to cancel; empty if the rule was
     * not installed
     */
    public List<EntanglementProtocol> expire(Rule rule) {
        if (!rules.remove(rule)) {
            return List.of();
        }
        return rule.getProtocols();
    }

    public boolean contains(Rule rule) {
        return rules.contains(rule);
    }

    public Rule get(int index) {
        return rules.get(index);
    }

    public int size() {
        return rules.size();
    }

    public List<Rule> getRules() {
        return List.copyOf(rules);
    }

    @Override
    public Iterator<Rule> iterator() {
        return getRules().iterator();
    }
}
