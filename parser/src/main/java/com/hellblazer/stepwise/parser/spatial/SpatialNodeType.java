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
package com.hellblazer.stepwise.parser.spatial;

/**
 * Kind of node in the spatial containment tree.
 *
 * @author hal.hildebrand
 */
public enum SpatialNodeType {
    PROJECT, SITE, BUILDING, STOREY, SPACE, FACILITY, FACILITY_PART, ELEMENT;

    public static SpatialNodeType fromTypeName(String typeName) {
        return switch (typeName) {
            case "IFCPROJECT" -> PROJECT;
            case "IFCSITE" -> SITE;
            case "IFCBUILDING" -> BUILDING;
            case "IFCBUILDINGSTOREY" -> STOREY;
            case "IFCSPACE" -> SPACE;
            case "IFCFACILITY", "IFCBRIDGE", "IFCROAD", "IFCRAILWAY", "IFCMARINEFACILITY" -> FACILITY;
            case "IFCFACILITYPART", "IFCBRIDGEPART", "IFCROADPART", "IFCRAILWAYPART", "IFCMARINEPART" ->
            FACILITY_PART;
            default -> ELEMENT;
        };
    }

    /**
     * @return true for spatial structure, false for building elements
     */
    public boolean isSpatial() {
        return this != ELEMENT;
    }
}
