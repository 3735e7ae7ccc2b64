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
package com.hellblazer.qnet.protocol;

import com.hellblazer.qnet.network.Payload;

/**
 * Outcome of a generation attempt, sent by the primary to its partner.
 *
 * @param success  whether a pair was heralded
 * @param memory   the primary's slot
 * @param fidelity fidelity of the new pair
 * @param time     time the pair was established
 * @author hal.hildebrand
 */
public record GenerationMessage(boolean success, int memory, double fidelity, long time) implements Payload {
}
