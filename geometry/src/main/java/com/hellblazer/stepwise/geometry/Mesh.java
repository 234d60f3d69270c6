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

import com.hellblazer.stepwise.common.FloatArrayList;
import com.hellblazer.stepwise.common.IntArrayList;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.Optional;

/**
 * Growable indexed triangle mesh. Every vertex carries a position and a normal, so the position and normal arrays
 * always have the same length; triangles are counter clockwise when seen from outside.
 * <p>
 * Not thread safe. Meshes handed out by the router are owned by the caller.
 *
 * @author hal.hildebrand
 */
public class Mesh {
    private static final double NORMAL_EPSILON = 1e-12;

    private final FloatArrayList positions;
    private final FloatArrayList normals;
    private final IntArrayList   indices;

    public Mesh() {
        this(16, 48);
    }

    /**
     * @param vertexCapacity expected vertices
     * @param indexCapacity  expected indices, three per triangle
     */
    public Mesh(int vertexCapacity, int indexCapacity) {
        positions = new FloatArrayList(vertexCapacity * 3);
        normals = new FloatArrayList(vertexCapacity * 3);
        indices = new IntArrayList(indexCapacity);
    }

    /**
     * @throws IllegalArgumentException if any index does not name an existing vertex
     */
    public void addTriangle(int a, int b, int c) {
        var count = vertexCount();
        if (a < 0 || b < 0 || c < 0 || a >= count || b >= count || c >= count) {
            throw new IllegalArgumentException(
            String.format("Triangle (%d, %d, %d) out of range for %d vertices", a, b, c, count));
        }
        indices.addTriangle(a, b, c);
    }

    /**
     * @return the index of the new vertex
     */
    public int addVertex(double x, double y, double z, double nx, double ny, double nz) {
        var index = vertexCount();
        positions.add3((float) x, (float) y, (float) z);
        normals.add3((float) nx, (float) ny, (float) nz);
        return index;
    }

    public int addVertex(Tuple3d position, Tuple3d normal) {
        return addVertex(position.x, position.y, position.z, normal.x, normal.y, normal.z);
    }

    /**
     * @return the total area of all triangles
     */
    public double area() {
        var area = 0.0;
        var a = new Point3d();
        var b = new Point3d();
        var c = new Point3d();
        var ab = new Vector3d();
        var ac = new Vector3d();
        var cross = new Vector3d();
        for (int t = 0; t < indices.size(); t += 3) {
            position(indices.getInt(t), a);
            position(indices.getInt(t + 1), b);
            position(indices.getInt(t + 2), c);
            ab.sub(b, a);
            ac.sub(c, a);
            cross.cross(ab, ac);
            area += cross.length() * 0.5;
        }
        return area;
    }

    /**
     * @return the bounds of all vertices, empty for a mesh without vertices
     */
    public Optional<BoundingBox> bounds() {
        if (positions.isEmpty()) {
            return Optional.empty();
        }
        var min = new Point3d(Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE);
        var max = new Point3d(-Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE);
        for (int i = 0; i < positions.size(); i += 3) {
            double x = positions.getFloat(i), y = positions.getFloat(i + 1), z = positions.getFloat(i + 2);
            min.set(Math.min(min.x, x), Math.min(min.y, y), Math.min(min.z, z));
            max.set(Math.max(max.x, x), Math.max(max.y, y), Math.max(max.z, z));
        }
        return Optional.of(new BoundingBox(min, max));
    }

    /**
     * Replace every normal with the area weighted average of the faces sharing the vertex. Vertices on no face, or
     * only on degenerate faces, get +Z.
     */
    public void computeNormals() {
        var accumulated = new double[positions.size()];
        var a = new Point3d();
        var b = new Point3d();
        var c = new Point3d();
        var ab = new Vector3d();
        var ac = new Vector3d();
        var face = new Vector3d();
        for (int t = 0; t < indices.size(); t += 3) {
            int i0 = indices.getInt(t), i1 = indices.getInt(t + 1), i2 = indices.getInt(t + 2);
            position(i0, a);
            position(i1, b);
            position(i2, c);
            ab.sub(b, a);
            ac.sub(c, a);
            // unnormalized cross product is twice the face area, which is the weight
            face.cross(ab, ac);
            for (var v : new int[] { i0, i1, i2 }) {
                accumulated[v * 3] += face.x;
                accumulated[v * 3 + 1] += face.y;
                accumulated[v * 3 + 2] += face.z;
            }
        }
        var n = new Vector3d();
        for (int v = 0; v < vertexCount(); v++) {
            n.set(accumulated[v * 3], accumulated[v * 3 + 1], accumulated[v * 3 + 2]);
            if (n.length() < NORMAL_EPSILON) {
                n.set(0, 0, 1);
            } else {
                n.normalize();
            }
            normals.setFloat(v * 3, (float) n.x);
            normals.setFloat(v * 3 + 1, (float) n.y);
            normals.setFloat(v * 3 + 2, (float) n.z);
        }
    }

    public Mesh copy() {
        var copy = new Mesh(vertexCount(), indices.size());
        copy.positions.addAll(positions);
        copy.normals.addAll(normals);
        copy.indices.addAll(indices);
        return copy;
    }

    public IntArrayList getIndices() {
        return indices;
    }

    public Vector3d getNormal(int vertex) {
        return new Vector3d(normals.getFloat(vertex * 3), normals.getFloat(vertex * 3 + 1),
                            normals.getFloat(vertex * 3 + 2));
    }

    public FloatArrayList getNormals() {
        return normals;
    }

    public Point3d getPosition(int vertex) {
        var p = new Point3d();
        position(vertex, p);
        return p;
    }

    public FloatArrayList getPositions() {
        return positions;
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Append {@code other}, shifting its indices past this mesh's vertices.
     */
    public void merge(Mesh other) {
        var offset = vertexCount();
        positions.addAll(other.positions);
        normals.addAll(other.normals);
        indices.addAllShifted(other.indices, offset);
    }

    /**
     * Flip every triangle and every normal.
     */
    public void reverseWinding() {
        for (int t = 0; t < indices.size(); t += 3) {
            var b = indices.getInt(t + 1);
            indices.setInt(t + 1, indices.getInt(t + 2));
            indices.setInt(t + 2, b);
        }
        normals.scale(-1f);
    }

    /**
     * Scale positions uniformly about the origin; normals are unchanged.
     */
    public void scale(double factor) {
        if (factor != 1.0) {
            positions.scale((float) factor);
        }
    }

    public MeshData toMeshData() {
        return new MeshData(positions.toArray(), normals.toArray(), indices.toArray());
    }

    /**
     * Apply an affine transform: positions by {@code matrix}, normals by the inverse transpose of its linear part.
     * A transform that mirrors (negative determinant) also flips the triangle winding so faces stay outward.
     */
    public void transform(Matrix4d matrix) {
        var linear = new Matrix3d();
        matrix.getRotationScale(linear);
        var determinant = linear.determinant();
        var normalMatrix = new Matrix3d(linear);
        if (Math.abs(determinant) > NORMAL_EPSILON) {
            normalMatrix.invert();
            normalMatrix.transpose();
        }
        var p = new Point3d();
        var n = new Vector3d();
        for (int v = 0; v < vertexCount(); v++) {
            position(v, p);
            matrix.transform(p);
            positions.setFloat(v * 3, (float) p.x);
            positions.setFloat(v * 3 + 1, (float) p.y);
            positions.setFloat(v * 3 + 2, (float) p.z);

            n.set(normals.getFloat(v * 3), normals.getFloat(v * 3 + 1), normals.getFloat(v * 3 + 2));
            normalMatrix.transform(n);
            if (n.length() > NORMAL_EPSILON) {
                n.normalize();
            }
            normals.setFloat(v * 3, (float) n.x);
            normals.setFloat(v * 3 + 1, (float) n.y);
            normals.setFloat(v * 3 + 2, (float) n.z);
        }
        if (determinant < 0) {
            for (int t = 0; t < indices.size(); t += 3) {
                var b = indices.getInt(t + 1);
                indices.setInt(t + 1, indices.getInt(t + 2));
                indices.setInt(t + 2, b);
            }
        }
    }

    public int triangleCount() {
        return indices.size() / 3;
    }

    public int vertexCount() {
        return positions.size() / 3;
    }

    @Override
    public String toString() {
        return String.format("Mesh[%d vertices, %d triangles]", vertexCount(), triangleCount());
    }

    private void position(int vertex, Point3d into) {
        into.set(positions.getFloat(vertex * 3), positions.getFloat(vertex * 3 + 1), positions.getFloat(vertex * 3 + 2));
    }
}
