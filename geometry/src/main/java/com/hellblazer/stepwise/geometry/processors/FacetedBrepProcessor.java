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

import com.hellblazer.stepwise.common.IntArrayList;
import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.Mesh;
import com.hellblazer.stepwise.geometry.triangulation.Triangulation;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IFCFACETEDBREP: Outer 0, a closed shell whose faces (CfsFaces 0) are bounded by poly loops.
 * <p>
 * A face bound (Bound 0, Orientation 1) reverses its loop when Orientation is {@code .F.}. The IFCFACEOUTERBOUND is
 * the face's outer loop, otherwise its first bound; every other bound is a hole. Faces are triangulated independently
 * and keep their own vertices, so shading stays flat across edges. Faces with fewer than three points are skipped.
 *
 * @author hal.hildebrand
 */
public final class FacetedBrepProcessor implements GeometryProcessor {
    public static final  String TYPE_NAME          = "IFCFACETEDBREP";
    public static final  String IFCFACEOUTERBOUND  = "IFCFACEOUTERBOUND";
    private static final Logger log                = LoggerFactory.getLogger(FacetedBrepProcessor.class);

    /**
     * Indices into the concatenation of {@code outer} and {@code holes}. Triangles and quads without holes are used
     * as given; anything that fails to triangulate falls back to a fan over the outer loop.
     */
    static IntArrayList triangulateFace(List<Point3d> outer, List<List<Point3d>> holes) {
        var n = outer.size();
        if (holes.isEmpty() && n == 3) {
            return IntArrayList.of(0, 1, 2);
        }
        if (holes.isEmpty() && n == 4) {
            return IntArrayList.of(0, 1, 2, 0, 2, 3);
        }
        try {
            return Triangulation.triangulate3D(outer, holes);
        } catch (GeometryException.Triangulation e) {
            log.debug("Face of {} points fanned: {}", n, e.getMessage());
            var fan = new IntArrayList((n - 2) * 3);
            for (int i = 1; i < n - 1; i++) {
                fan.addTriangle(0, i, i + 1);
            }
            return fan;
        }
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public Mesh process(DecodedEntity entity, EntityResolver resolver) {
        var shell = resolver.resolve(entity.requireRef(0, "Outer"));
        var mesh = new Mesh();
        var skipped = 0;
        for (var faceId : shell.getRefs(0)) {
            if (!addFace(mesh, resolver.resolve(faceId), resolver)) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("{} skipped {} degenerate faces", entity.getId(), skipped);
        }
        mesh.computeNormals();
        return mesh;
    }

    private boolean addFace(Mesh mesh, DecodedEntity face, EntityResolver resolver) {
        List<Point3d> outer = null;
        var holes = new ArrayList<List<Point3d>>();
        for (var boundId : face.getRefs(0)) {
            var bound = resolver.resolve(boundId);
            var points = loopPoints(bound.requireRef(0, "Bound"), resolver);
            if (points.size() < 3) {
                continue;
            }
            if ("F".equals(bound.getEnum(1).orElse("T"))) {
                Collections.reverse(points);
            }
            var isOuter = bound.isType(IFCFACEOUTERBOUND);
            if (outer == null) {
                outer = points;
            } else if (isOuter) {
                holes.add(outer);
                outer = points;
            } else {
                holes.add(points);
            }
        }
        if (outer == null) {
            return false;
        }

        var indices = triangulateFace(outer, holes);
        var base = mesh.vertexCount();
        for (var p : outer) {
            mesh.addVertex(p.x, p.y, p.z, 0, 0, 1);
        }
        for (var hole : holes) {
            for (var p : hole) {
                mesh.addVertex(p.x, p.y, p.z, 0, 0, 1);
            }
        }
        for (int t = 0; t < indices.size(); t += 3) {
            mesh.addTriangle(base + indices.getInt(t), base + indices.getInt(t + 1), base + indices.getInt(t + 2));
        }
        return true;
    }

    private List<Point3d> loopPoints(EntityId loopId, EntityResolver resolver) {
        var loop = resolver.resolve(loopId);
        var points = new ArrayList<Point3d>();
        for (var pointId : loop.getRefs(0)) {
            points.add(PlacementResolver.point(pointId, resolver));
        }
        return points;
    }
}
