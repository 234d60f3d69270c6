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

import com.hellblazer.stepwise.parser.EntityId;

import java.util.List;
import java.util.OptionalDouble;

/**
 * A node of the spatial tree. Children are held as ids, in the order their relationships appear in the file.
 *
 * @author hal.hildebrand
 */
public final class SpatialNode {
    private final EntityId        id;
    private final SpatialNodeType type;
    private final String          name;
    private final String          typeName;
    private final Double          elevation;
    private final boolean         hasGeometry;
    private final List<EntityId>  children;

    public SpatialNode(EntityId id, SpatialNodeType type, String name, String typeName, Double elevation,
                       boolean hasGeometry, List<EntityId> children) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.typeName = typeName;
        this.elevation = elevation;
        this.hasGeometry = hasGeometry;
        this.children = List.copyOf(children);
    }

    public List<EntityId> getChildren() {
        return children;
    }

    /**
     * @return the storey elevation, empty for other node types or when the file leaves it unset
     */
    public OptionalDouble getElevation() {
        return elevation == null ? OptionalDouble.empty() : OptionalDouble.of(elevation);
    }

    public EntityId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SpatialNodeType getType() {
        return type;
    }

    public String getTypeName() {
        return typeName;
    }

    public boolean hasGeometry() {
        return hasGeometry;
    }

    @Override
    public String toString() {
        return String.format("SpatialNode[%s %s '%s', %d children]", id, typeName, name, children.size());
    }
}
