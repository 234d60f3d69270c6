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

import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.Mesh;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityResolver;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;

/**
 * IFCSWEPTDISKSOLID: Directrix 0, Radius 1. A tube of rings around each directrix point, capped at both ends.
 * <p>
 * Ring frames come from the local tangent (one sided at the ends, central difference elsewhere) crossed with whichever
 * of X or Y is less aligned with it. The InnerRadius and parameter range attributes are not read.
 *
 * @author hal.hildebrand
 */
public final class SweptDiskSolidProcessor implements GeometryProcessor {
    public static final String TYPE_NAME = "IFCSWEPTDISKSOLID";

    private final ProfileExtractor curves;
    private final int              segments;

    public SweptDiskSolidProcessor(ProfileExtractor curves, int segments) {
        this.curves = curves;
        this.segments = segments;
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public Mesh process(DecodedEntity entity, EntityResolver resolver) {
        var radius = entity.requireFloat(1, "Radius");
        if (!(radius > 0)) {
            throw new GeometryException.Profile(
            String.format("swept disk radius of %s must be positive: %s", entity.getId(), radius));
        }
        var path = curves.curvePoints3D(entity.requireRef(0, "Directrix"), resolver);
        if (path.size() < 2) {
            return new Mesh();
        }

        var count = path.size();
        var mesh = new Mesh(count * segments + 2, (count - 1) * segments * 6 + segments * 6);
        var offset = new Vector3d();
        var vertex = new Point3d();
        for (int i = 0; i < count; i++) {
            var p = path.get(i);
            var tangent = tangent(path, i);
            var up = Math.abs(tangent.x) < 0.9 ? new Vector3d(1, 0, 0) : new Vector3d(0, 1, 0);
            var perp1 = new Vector3d();
            perp1.cross(tangent, up);
            perp1.normalize();
            var perp2 = new Vector3d();
            perp2.cross(tangent, perp1);
            perp2.normalize();
            for (int j = 0; j < segments; j++) {
                var angle = 2.0 * Math.PI * j / segments;
                offset.scale(radius * Math.cos(angle), perp1);
                offset.scaleAdd(radius * Math.sin(angle), perp2, offset);
                vertex.add(p, offset);
                mesh.addVertex(vertex.x, vertex.y, vertex.z, offset.x, offset.y, offset.z);
            }
        }
        for (int i = 0; i < count - 1; i++) {
            var base = i * segments;
            var nextBase = (i + 1) * segments;
            for (int j = 0; j < segments; j++) {
                var jn = (j + 1) % segments;
                // rings run counter clockwise about the tangent, so this order faces outward
                mesh.addTriangle(base + j, nextBase + jn, nextBase + j);
                mesh.addTriangle(base + j, base + jn, nextBase + jn);
            }
        }

        var start = path.get(0);
        var startCenter = mesh.addVertex(start.x, start.y, start.z, 0, 0, 1);
        for (int j = 0; j < segments; j++) {
            mesh.addTriangle(startCenter, (j + 1) % segments, j);
        }
        var end = path.get(count - 1);
        var endCenter = mesh.addVertex(end.x, end.y, end.z, 0, 0, 1);
        var endBase = (count - 1) * segments;
        for (int j = 0; j < segments; j++) {
            mesh.addTriangle(endCenter, endBase + j, endBase + (j + 1) % segments);
        }
        mesh.computeNormals();
        return mesh;
    }

    private Vector3d tangent(List<Point3d> path, int i) {
        var last = path.size() - 1;
        var tangent = new Vector3d();
        if (i == 0) {
            tangent.sub(path.get(1), path.get(0));
        } else if (i == last) {
            tangent.sub(path.get(last), path.get(last - 1));
        } else {
            tangent.sub(path.get(i + 1), path.get(i - 1));
        }
        if (tangent.length() < 1e-12) {
            tangent.set(0, 0, 1);
        }
        tangent.normalize();
        return tangent;
    }
}
