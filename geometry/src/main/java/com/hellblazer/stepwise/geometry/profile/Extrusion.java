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
package com.hellblazer.stepwise.geometry.profile;

import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.Mesh;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point2d;
import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Linear sweep of a {@link Profile2D} into a closed solid.
 * <p>
 * The profile lies in the XY plane at z = 0; the top cap is the profile translated by {@code depth * direction}, so an
 * oblique direction yields a sheared prism. Caps and walls use separate vertices so every wall quad carries its own
 * flat normal.
 *
 * @author hal.hildebrand
 */
public final class Extrusion {
    private static final double EPSILON = 1e-12;

    private Extrusion() {
    }

    /**
     * Apply an affine placement: positions by {@code transform}, normals by the inverse transpose of its linear part.
     */
    public static void applyTransform(Mesh mesh, Matrix4d transform) {
        mesh.transform(transform);
    }

    /**
     * @param direction extrusion direction, normalized here; null means +Z
     * @throws GeometryException.Profile if {@code depth <= 0} or the direction is zero or parallel to the profile
     *                                   plane
     */
    public static Mesh extrudeProfile(Profile2D profile, double depth, Vector3d direction) {
        if (!(depth > 0)) {
            throw new GeometryException.Profile(String.format("extrusion depth must be positive: %s", depth));
        }
        var dir = direction == null ? new Vector3d(0, 0, 1) : new Vector3d(direction);
        if (dir.length() < EPSILON) {
            throw new GeometryException.Profile("zero length extrusion direction");
        }
        dir.normalize();
        if (Math.abs(dir.z) < EPSILON) {
            throw new GeometryException.Profile(
            String.format("extrusion direction %s lies in the profile plane", dir));
        }

        var points = profile.allPoints();
        var triangles = profile.triangulate();
        var n = points.size();
        var offset = new Vector3d(dir);
        offset.scale(depth);

        var mesh = new Mesh(n * 6, triangles.size() * 2 + n * 6);

        // bottom cap faces against the sweep
        var bottom = mesh.vertexCount();
        for (var p : points) {
            mesh.addVertex(p.x, p.y, 0, -dir.x, -dir.y, -dir.z);
        }
        for (int t = 0; t < triangles.size(); t += 3) {
            mesh.addTriangle(bottom + triangles.getInt(t), bottom + triangles.getInt(t + 2),
                             bottom + triangles.getInt(t + 1));
        }

        var top = mesh.vertexCount();
        for (var p : points) {
            mesh.addVertex(p.x + offset.x, p.y + offset.y, offset.z, dir.x, dir.y, dir.z);
        }
        for (int t = 0; t < triangles.size(); t += 3) {
            mesh.addTriangle(top + triangles.getInt(t), top + triangles.getInt(t + 1), top + triangles.getInt(t + 2));
        }

        var side = Math.signum(dir.z);
        addWalls(mesh, profile.getOuter(), offset, side);
        for (var hole : profile.getHoles()) {
            addWalls(mesh, hole, offset, side);
        }

        if (side < 0) {
            // swept below the profile plane: normals are outward but every triangle is inside out
            var indices = mesh.getIndices();
            for (int t = 0; t < indices.size(); t += 3) {
                var b = indices.getInt(t + 1);
                indices.setInt(t + 1, indices.getInt(t + 2));
                indices.setInt(t + 2, b);
            }
        }
        return mesh;
    }

    /**
     * Extrude with additional through voids cut from the profile. Each void becomes a hole with inward facing walls.
     *
     * @throws GeometryException.Csg if a void is not strictly inside the outer loop
     */
    public static Mesh extrudeProfileWithVoids(Profile2D profile, double depth, Vector3d direction,
                                               List<List<Point2d>> voids) {
        for (int v = 0; v < voids.size(); v++) {
            for (var p : voids.get(v)) {
                if (!profile.contains(p)) {
                    throw new GeometryException.Csg(
                    String.format("void %d point (%s, %s) is not inside the profile", v, p.x, p.y));
                }
            }
        }
        return extrudeProfile(profile.withHoles(voids), depth, direction);
    }

    /**
     * Two triangles per loop edge. The wall normal is {@code side * (edge × direction)}, outward for counter clockwise
     * outer loops and, for clockwise holes, pointing into the void.
     */
    private static void addWalls(Mesh mesh, List<Point2d> loop, Vector3d offset, double side) {
        var n = loop.size();
        var edge = new Vector3d();
        var normal = new Vector3d();
        for (int i = 0; i < n; i++) {
            var a = loop.get(i);
            var b = loop.get((i + 1) % n);
            edge.set(b.x - a.x, b.y - a.y, 0);
            normal.cross(edge, offset);
            if (normal.length() < EPSILON) {
                continue;
            }
            normal.normalize();
            normal.scale(side);
            var a0 = mesh.addVertex(a.x, a.y, 0, normal.x, normal.y, normal.z);
            var b0 = mesh.addVertex(b.x, b.y, 0, normal.x, normal.y, normal.z);
            var b1 = mesh.addVertex(b.x + offset.x, b.y + offset.y, offset.z, normal.x, normal.y, normal.z);
            var a1 = mesh.addVertex(a.x + offset.x, a.y + offset.y, offset.z, normal.x, normal.y, normal.z);
            mesh.addTriangle(a0, b0, b1);
            mesh.addTriangle(a0, b1, a1);
        }
    }
}
