/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Stepwise.
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
package com.hellblazer.stepwise.parser;

/**
 * Identifier of one STEP entity instance, the {@code n} of {@code #n}. Unsigned 32 bit, unique within a file and the
 * only way one entity refers to another.
 *
 * @author hal.hildebrand
 */
public record EntityId(long value) implements Comparable<EntityId> {

    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    public EntityId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Entity id out of unsigned 32 bit range: " + value);
        }
    }

    public static EntityId of(long value) {
        return new EntityId(value);
    }

    @Override
    public int compareTo(EntityId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
