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
package com.hellblazer.qnet.kernel;

/**
 * Thrown when an event is scheduled before the timeline's current time.
 *
 * @author hal.hildebrand
 */
public class InvalidTimeException extends RuntimeException {

    private final long requested;
    private final long now;

    public InvalidTimeException(long requested, long now) {
        super(String.format("Cannot schedule event at %d, current time is %d", requested, now));
        this.requested = requested;
        this.now = now;
    }

    public long getRequested() {
        return requested;
    }

    public long getNow() {
        return now;
    }
}
