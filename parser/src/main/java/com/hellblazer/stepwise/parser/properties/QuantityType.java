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

import java.util.Optional;

/**
 * Kind of an element quantity, taken from the quantity entity's own type. {@link #UNTYPED} holds quantity entities of
 * any other type.
 *
 * @author hal.hildebrand
 */
public enum QuantityType {
    LENGTH("IFCQUANTITYLENGTH", "m"),
    AREA("IFCQUANTITYAREA", "m²"),
    VOLUME("IFCQUANTITYVOLUME", "m³"),
    COUNT("IFCQUANTITYCOUNT", ""),
    WEIGHT("IFCQUANTITYWEIGHT", "kg"),
    TIME("IFCQUANTITYTIME", "s"),
    UNTYPED(null, "");

    private final String typeName;
    private final String defaultUnit;

    QuantityType(String typeName, String defaultUnit) {
        this.typeName = typeName;
        this.defaultUnit = defaultUnit;
    }

    public static Optional<QuantityType> fromTypeName(String typeName) {
        for (var type : values()) {
            if (type.typeName != null && type.typeName.equals(typeName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String getDefaultUnit() {
        return defaultUnit;
    }
}
