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
package com.hellblazer.stepwise.geometry.triangulation;

import com.hellblazer.stepwise.common.IntArrayList;
import com.hellblazer.stepwise.geometry.GeometryException;

import javax.vecmath.Point2d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

/**
 * Polygon triangulation for profiles and B-rep faces.
 * <p>
 * 2D entry points take the outer loop and optional holes and return vertex indices, three per triangle, into the
 * concatenation of the outer loop followed by each hole in order. Triangles keep the winding of the outer loop: a
 * counter clockwise outer loop yields counter clockwise triangles. 3D loops are first projected onto their best fit
 * plane, found with Newell's method, so the triangles of a 3D face wind counter clockwise about its normal.
 * <p>
 * Triangles and convex polygons of up to {@value #MAX_FAN_VERTICES} vertices are fanned; everything else goes
 * through ear clipping.
 *
 * @author hal.hildebrand
 */
public final class Triangulation {
    public static final  double MIN_AREA         = 1e-12;
    static final         int    MAX_FAN_VERTICES = 8;
    private static final double NORMAL_EPSILON   = 1e-12;

    private Triangulation() {
    }

    /**
     * Newell's method, robust to slightly non planar loops. Triangles and quads use a single cross product.
     *
     * @return the unit normal, or +Z for a degenerate loop
     */
    public static Vector3d calculatePolygonNormal(List<Point3d> points) {
        var normal = new Vector3d();
        var n = points.size();
        if (n == 3) {
            normal.cross(difference(points.get(1), points.get(0)), difference(points.get(2), points.get(0)));
        } else if (n == 4) {
            normal.cross(difference(points.get(2), points.get(0)), difference(points.get(3), points.get(1)));
        } else {
            for (int i = 0; i < n; i++) {
                var current = points.get(i);
                var next = points.get((i + 1) % n);
                normal.x += (current.y - next.y) * (current.z + next.z);
                normal.y += (current.z - next.z) * (current.x + next.x);
                normal.z += (current.x - next.x) * (current.y + next.y);
            }
        }
        var length = normal.length();
        if (length < NORMAL_EPSILON) {
            return new Vector3d(0, 0, 1);
        }
        normal.scale(1.0 / length);
        return normal;
    }

    /**
     * @return true when every turn of the loop bends the same way; collinear runs are allowed
     */
    public static boolean isConvex(List<Point2d> points) {
        var n = points.size();
        var sign = 0;
        for (int i = 0; i < n; i++) {
            var a = points.get(i);
            var b = points.get((i + 1) % n);
            var c = points.get((i + 2) % n);
            var cross = (b.x - a.x) * (c.y - b.y) - (b.y - a.y) * (c.x - b.x);
            if (Math.abs(cross) < MIN_AREA) {
                continue;
            }
            var s = cross > 0 ? 1 : -1;
            if (sign == 0) {
                sign = s;
            } else if (s != sign) {
                return false;
            }
        }
        return true;
    }

    /**
     * Project a loop onto the plane through its first point with the given normal.
     */
    public static Projection projectTo2D(List<Point3d> points, Vector3d normal) {
        if (points.isEmpty()) {
            throw new GeometryException.Triangulation("cannot project an empty loop");
        }
        var basis = ProjectionBasis.of(points.get(0), normal);
        return new Projection(projectTo2DWithBasis(points, basis), basis);
    }

    /**
     * Project further loops, such as holes, into an existing basis.
     */
    public static List<Point2d> projectTo2DWithBasis(List<Point3d> points, ProjectionBasis basis) {
        var projected = new ArrayList<Point2d>(points.size());
        for (var p : points) {
            projected.add(basis.project(p));
        }
        return projected;
    }

    /**
     * Twice the signed area of a loop, positive when counter clockwise.
     */
    public static double signedArea(List<Point2d> points) {
        var sum = 0.0;
        var n = points.size();
        for (int i = 0; i < n; i++) {
            var a = points.get(i);
            var b = points.get((i + 1) % n);
            sum += a.x * b.y - b.x * a.y;
        }
        return sum;
    }

    /**
     * Triangulate a 3D face given as an outer loop and holes, all in the same plane.
     */
    public static IntArrayList triangulate3D(List<Point3d> outer, List<List<Point3d>> holes) {
        if (outer.size() < 3) {
            throw new GeometryException.Triangulation(
            String.format("polygon needs at least 3 points, found %d", outer.size()));
        }
        var projection = projectTo2D(outer, calculatePolygonNormal(outer));
        var projectedHoles = new ArrayList<List<Point2d>>(holes.size());
        for (var hole : holes) {
            projectedHoles.add(projectTo2DWithBasis(hole, projection.basis()));
        }
        return triangulatePolygonWithHoles(projection.points(), projectedHoles);
    }

    /**
     * @throws GeometryException.Triangulation for fewer than 3 points or a zero area loop
     */
    public static IntArrayList triangulatePolygon(List<Point2d> points) {
        var n = points.size();
        var area = validate(points, "polygon");
        if (n == 3) {
            return IntArrayList.of(0, 1, 2);
        }
        if (n <= MAX_FAN_VERTICES && isConvex(points)) {
            var fan = new IntArrayList((n - 2) * 3);
            for (int i = 1; i < n - 1; i++) {
                fan.addTriangle(0, i, i + 1);
            }
            return fan;
        }
        return earcut(points, List.of(), area);
    }

    /**
     * @throws GeometryException.Triangulation for an outer loop or hole with fewer than 3 points, or a zero area
     *                                         outer loop
     */
    public static IntArrayList triangulatePolygonWithHoles(List<Point2d> outer, List<List<Point2d>> holes) {
        if (holes.isEmpty()) {
            return triangulatePolygon(outer);
        }
        var area = validate(outer, "outer loop");
        for (var hole : holes) {
            if (hole.size() < 3) {
                throw new GeometryException.Triangulation(
                String.format("hole needs at least 3 points, found %d", hole.size()));
            }
        }
        return earcut(outer, holes, area);
    }

    private static Vector3d difference(Point3d a, Point3d b) {
        var d = new Vector3d();
        d.sub(a, b);
        return d;
    }

    private static IntArrayList earcut(List<Point2d> outer, List<List<Point2d>> holes, double outerArea) {
        var total = outer.size();
        for (var hole : holes) {
            total += hole.size();
        }
        var data = new double[total * 2];
        var holeIndices = new int[holes.size()];
        var k = 0;
        for (var p : outer) {
            data[k++] = p.x;
            data[k++] = p.y;
        }
        for (int h = 0; h < holes.size(); h++) {
            holeIndices[h] = k / 2;
            for (var p : holes.get(h)) {
                data[k++] = p.x;
                data[k++] = p.y;
            }
        }
        var triangles = Earcut.triangulate(data, holeIndices);
        if (triangles.isEmpty()) {
            throw new GeometryException.Triangulation(
            String.format("no triangles for a loop of %d points and %d holes", outer.size(), holes.size()));
        }
        if (outerArea < 0) {
            // clockwise input; ear clipping always emits counter clockwise triangles
            for (int t = 0; t < triangles.size(); t += 3) {
                var b = triangles.getInt(t + 1);
                triangles.setInt(t + 1, triangles.getInt(t + 2));
                triangles.setInt(t + 2, b);
            }
        }
        return triangles;
    }

    private static double validate(List<Point2d> points, String what) {
        if (points.size() < 3) {
            throw new GeometryException.Triangulation(
            String.format("%s needs at least 3 points, found %d", what, points.size()));
        }
        var area = signedArea(points);
        if (Math.abs(area) < MIN_AREA) {
            throw new GeometryException.Triangulation(String.format("%s has zero area", what));
        }
        return area;
    }
}
