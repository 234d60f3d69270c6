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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Axis aligned bounds of a mesh.
 *
 * @author hal.hildebrand
 */
public record BoundingBox(Point3d min, Point3d max) {

    public Point3d center() {
        var center = new Point3d();
        center.interpolate(min, max, 0.5);
        return center;
    }

    public Vector3d size() {
        var size = new Vector3d();
        size.sub(max, min);
        return size;
    }

    /**
     * @return the smallest box enclosing this box and {@code other}
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(new Point3d(Math.min(min.x, other.min.x), Math.min(min.y, other.min.y),
                                           Math.min(min.z, other.min.z)),
                               new Point3d(Math.max(max.x, other.max.x), Math.max(max.y, other.max.y),
                                           Math.max(max.z, other.max.z)));
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[(%.4f, %.4f, %.4f) - (%.4f, %.4f, %.4f)]", min.x, min.y, min.z, max.x,
                             max.y, max.z);
    }
}
