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
package com.hellblazer.stepwise.geometry.processors;

import com.hellblazer.stepwise.geometry.Mesh;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;

import javax.vecmath.Vector3d;
import java.util.List;

/**
 * IFCTRIANGULATEDFACESET: Coordinates 0 (an IFCCARTESIANPOINTLIST3D, CoordList 0) and CoordIndex 3, one based.
 *
 * @author hal.hildebrand
 */
public final class TriangulatedFaceSetProcessor implements GeometryProcessor {
    public static final String TYPE_NAME = "IFCTRIANGULATEDFACESET";

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    /**
     * @throws StepException.InvalidAttribute if a triangle is not three indices or an index is out of range
     */
    @Override
    public Mesh process(DecodedEntity entity, EntityResolver resolver) {
        var pointList = resolver.resolve(entity.requireRef(0, "Coordinates"));
        var coordinates = pointList.requireList(0, "CoordList");
        var triangles = entity.requireList(3, "CoordIndex");

        var mesh = new Mesh(coordinates.size(), triangles.size() * 3);
        for (var coordinate : coordinates) {
            var ordinates = coordinate.asList()
                                      .orElseThrow(() -> new StepException.InvalidAttribute(pointList.getId(), 0,
                                                                                           "coordinate is not a list"));
            mesh.addVertex(PlacementResolver.coordinates(ordinates, 0.0), new Vector3d(0, 0, 1));
        }

        var vertexCount = coordinates.size();
        for (var triangle : triangles) {
            var corners = triangle.asList().orElse(List.of());
            if (corners.size() != 3) {
                throw new StepException.InvalidAttribute(entity.getId(), 3,
                                                         String.format("triangle with %d indices", corners.size()));
            }
            var index = new int[3];
            for (int k = 0; k < 3; k++) {
                var oneBased = corners.get(k).asLong();
                if (oneBased.isEmpty() || oneBased.getAsLong() < 1 || oneBased.getAsLong() > vertexCount) {
                    throw new StepException.InvalidAttribute(entity.getId(), 3,
                                                             String.format("coordinate index %s outside 1..%d",
                                                                           corners.get(k), vertexCount));
                }
                index[k] = (int) oneBased.getAsLong() - 1;
            }
            mesh.addTriangle(index[0], index[1], index[2]);
        }
        mesh.computeNormals();
        return mesh;
    }
}
