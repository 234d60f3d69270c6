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
package com.hellblazer.stepwise.parser.properties;

/**
 * One property of a property set, with its value rendered as text.
 *
 * @param unit display unit such as {@code "mm"}, empty when the property declares none
 * @author hal.hildebrand
 */
public record Property(String name, String value, String unit) {

    public Property(String name, String value) {
        this(name, value, "");
    }

    public boolean hasUnit() {
        return !unit.isEmpty();
    }
}
