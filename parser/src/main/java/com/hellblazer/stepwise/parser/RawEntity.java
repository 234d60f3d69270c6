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
 * One scanned entity record, {@code #id = TYPE(args);}, whose argument list has not been tokenized yet.
 *
 * @param id       the entity id
 * @param typeName the type name as written, STEP convention is upper case
 * @param offset   offset of the record's leading {@code #}
 * @param argStart offset of the opening parenthesis of the argument list
 * @param argEnd   offset one past the closing parenthesis of the argument list
 * @author hal.hildebrand
 */
public record RawEntity(EntityId id, String typeName, int offset, int argStart, int argEnd) {

    public RawEntity {
        if (argStart < offset || argEnd <= argStart) {
            throw new IllegalArgumentException(
            String.format("Invalid argument span [%d, %d) for record at %d", argStart, argEnd, offset));
        }
    }

    /**
     * @return the raw argument text within {@code content}, parentheses included
     */
    public String arguments(String content) {
        return content.substring(argStart, argEnd);
    }
}
