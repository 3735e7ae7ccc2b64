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
package com.hellblazer.qnet.resource.hardware;

/**
 * The hardware collaborator of a quantum router. Supplies the durations and success odds of physical steps, and the
 * random draws that decide their outcomes.
 *
 * @author hal.hildebrand
 */
public interface Hardware {

    /**
     * @return number of memory slots
     */
    int memorySize();

    /**
     * @return fidelity of freshly generated pairs
     */
    double rawFidelity();

    /**
     * @return how long an entangled memory stays usable, in picoseconds; non-positive means forever
     */
    long coherenceTime();

    /**
     * @return duration of the given physical step, in picoseconds
     */
    long delay(DelayKind kind);

    /**
     * @return probability that a single generation attempt with the peer succeeds
     */
    double generationSuccessProbability(String peer);

    /**
     * Draw a Bernoulli outcome.
     *
     * @param probability success probability
     * @return true on success
     */
    boolean drawSuccess(double probability);
}
