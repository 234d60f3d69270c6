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
package com.hellblazer.stepwise.geometry;

import com.hellblazer.stepwise.parser.EntityId;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Meshes of a whole model, keyed by product id in id order, plus the products that could not be tessellated.
 *
 * @author hal.hildebrand
 */
public record TessellationResult(SortedMap<EntityId, Mesh> meshes, List<Failure> failures) {

    public TessellationResult {
        meshes = Collections.unmodifiableSortedMap(new TreeMap<>(meshes));
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return the union of every mesh's bounds, empty when there are no meshes
     */
    public Optional<BoundingBox> bounds() {
        BoundingBox union = null;
        for (var mesh : meshes.values()) {
            var box = mesh.bounds();
            if (box.isEmpty()) {
                continue;
            }
            union = union == null ? box.get() : union.union(box.get());
        }
        return Optional.ofNullable(union);
    }

    public Map<EntityId, MeshData> toMeshData() {
        var data = new TreeMap<EntityId, MeshData>();
        meshes.forEach((id, mesh) -> data.put(id, mesh.toMeshData()));
        return data;
    }

    public int triangleCount() {
        return meshes.values().stream().mapToInt(Mesh::triangleCount).sum();
    }

    @Override
    public String toString() {
        return String.format("TessellationResult[%d meshes, %d triangles, %d failures]", meshes.size(),
                             triangleCount(), failures.size());
    }

    /**
     * A product whose geometry could not be built.
     */
    public record Failure(EntityId id, String typeName, RuntimeException cause) {
        @Override
        public String toString() {
            return String.format("%s %s: %s", id, typeName, cause.getMessage());
        }
    }
}
