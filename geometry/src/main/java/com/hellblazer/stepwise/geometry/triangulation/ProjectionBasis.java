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

import javax.vecmath.Point2d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Orthonormal frame of a polygon's best fit plane. {@code u}, {@code v} and {@code normal} form a right handed
 * basis, so a loop winding counter clockwise about {@code normal} stays counter clockwise in (u, v).
 *
 * @author hal.hildebrand
 */
public record ProjectionBasis(Point3d origin, Vector3d u, Vector3d v, Vector3d normal) {

    /**
     * Basis for a plane through {@code origin} with the given unit normal. The reference axis is the world axis
     * least aligned with the normal: {@code u = normal × ref}, {@code v = normal × u}.
     */
    public static ProjectionBasis of(Point3d origin, Vector3d normal) {
        var n = new Vector3d(normal);
        n.normalize();
        var ax = Math.abs(n.x);
        var ay = Math.abs(n.y);
        var az = Math.abs(n.z);
        Vector3d ref;
        if (ax <= ay && ax <= az) {
            ref = new Vector3d(1, 0, 0);
        } else if (ay <= az) {
            ref = new Vector3d(0, 1, 0);
        } else {
            ref = new Vector3d(0, 0, 1);
        }
        var u = new Vector3d();
        u.cross(n, ref);
        u.normalize();
        var v = new Vector3d();
        v.cross(n, u);
        v.normalize();
        return new ProjectionBasis(new Point3d(origin), u, v, n);
    }

    public Point2d project(Tuple3d point) {
        var d = new Vector3d(point.x - origin.x, point.y - origin.y, point.z - origin.z);
        return new Point2d(d.dot(u), d.dot(v));
    }

    public Point3d unproject(Point2d point) {
        return new Point3d(origin.x + u.x * point.x + v.x * point.y, origin.y + u.y * point.x + v.y * point.y,
                           origin.z + u.z * point.x + v.z * point.y);
    }
}
