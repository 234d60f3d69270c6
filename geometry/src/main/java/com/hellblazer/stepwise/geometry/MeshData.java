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

import java.util.Arrays;

/**
 * Flat, renderer ready form of a {@link Mesh}: xyz triples for positions and normals, three indices per triangle.
 * The arrays are copied on construction and on access, so an instance never changes.
 *
 * @author hal.hildebrand
 */
public record MeshData(float[] positions, float[] normals, int[] indices) {

    public MeshData {
        if (positions.length % 3 != 0 || normals.length != positions.length || indices.length % 3 != 0) {
            throw new IllegalArgumentException(
            String.format("Inconsistent mesh data: %d positions, %d normals, %d indices", positions.length,
                          normals.length, indices.length));
        }
        positions = positions.clone();
        normals = normals.clone();
        indices = indices.clone();
    }

    public static MeshData empty() {
        return new MeshData(new float[0], new float[0], new int[0]);
    }

    @Override
    public float[] positions() {
        return positions.clone();
    }

    @Override
    public float[] normals() {
        return normals.clone();
    }

    @Override
    public int[] indices() {
        return indices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeshData that)) {
            return false;
        }
        return Arrays.equals(positions, that.positions) && Arrays.equals(normals, that.normals) && Arrays.equals(
        indices, that.indices);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(positions) + Arrays.hashCode(normals)) + Arrays.hashCode(indices);
    }

    public int triangleCount() {
        return indices.length / 3;
    }

    public int vertexCount() {
        return positions.length / 3;
    }

    @Override
    public String toString() {
        return String.format("MeshData[%d vertices, %d triangles]", vertexCount(), triangleCount());
    }
}
