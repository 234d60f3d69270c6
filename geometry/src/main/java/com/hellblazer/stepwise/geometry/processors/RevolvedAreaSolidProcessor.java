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

/**
 * IFCREVOLVEDAREASOLID: SweptArea 0, Position 1, Axis 2 (an IFCAXIS1PLACEMENT, location 0 and direction 1 defaulting
 * to +Y), Angle 3 in radians.
 * <p>
 * Each profile point is read as (radius, height): the point {@code (x, 0, 0)} is rotated about the axis by Rodrigues'
 * formula and lifted {@code y} along it. A full turn repeats its first ring as the last so the seam closes.
 *
 * @author hal.hildebrand
 */
public final class RevolvedAreaSolidProcessor implements GeometryProcessor {
    public static final  String TYPE_NAME   = "IFCREVOLVEDAREASOLID";
    private static final double FULL_TURN   = Math.PI * 1.99;
    private static final int    MIN_SEGMENTS = 4;

    private final ProfileExtractor profiles;
    private final int              fullTurnSegments;

    public RevolvedAreaSolidProcessor(ProfileExtractor profiles, int fullTurnSegments) {
        this.profiles = profiles;
        this.fullTurnSegments = fullTurnSegments;
    }

    /**
     * Rotate {@code v} by {@code angle} about the unit vector {@code k}.
     */
    static Vector3d rotate(Vector3d v, Vector3d k, double angle) {
        var cos = Math.cos(angle);
        var sin = Math.sin(angle);
        var kxv = new Vector3d();
        kxv.cross(k, v);
        var rotated = new Vector3d(v);
        rotated.scale(cos);
        rotated.scaleAdd(sin, kxv, rotated);
        rotated.scaleAdd(k.dot(v) * (1.0 - cos), k, rotated);
        return rotated;
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public Mesh process(DecodedEntity entity, EntityResolver resolver) {
        var profile = profiles.extract(resolver.resolve(entity.requireRef(0, "SweptArea")), resolver);
        var axis = resolver.resolve(entity.requireRef(2, "Axis"));
        var angle = entity.requireFloat(3, "Angle");
        if (Math.abs(angle) < 1e-12) {
            throw new GeometryException.Profile(String.format("revolution angle of %s is zero", entity.getId()));
        }

        var origin = axis.getRef(0).map(id -> PlacementResolver.point(id, resolver)).orElseGet(Point3d::new);
        var direction = axis.getRef(1)
                            .map(id -> PlacementResolver.direction(id, resolver))
                            .orElseGet(() -> new Vector3d(0, 1, 0));

        var fullTurn = Math.abs(angle) >= FULL_TURN;
        var segments = segments(angle);
        var points = profile.getOuter();
        var n = points.size();

        var mesh = new Mesh((segments + 1) * n, segments * n * 6);
        var position = new Point3d();
        for (int i = 0; i <= segments; i++) {
            var t = fullTurn && i == segments ? 0.0 : angle * i / segments;
            for (var p : points) {
                var rotated = rotate(new Vector3d(p.x, 0, 0), direction, t);
                position.set(origin);
                position.scaleAdd(p.y, direction, position);
                position.add(rotated);
                mesh.addVertex(position.x, position.y, position.z, 0, 0, 1);
            }
        }
        for (int i = 0; i < segments; i++) {
            for (int j = 0; j < n; j++) {
                var current = i * n + j;
                var next = (i + 1) * n + j;
                var jn = (j + 1) % n;
                var currentNext = i * n + jn;
                var nextNext = (i + 1) * n + jn;
                mesh.addTriangle(current, next, nextNext);
                mesh.addTriangle(current, nextNext, currentNext);
            }
        }
        if (angle < 0) {
            // sweeping backwards turns the faces inside out
            mesh.reverseWinding();
        }
        mesh.computeNormals();

        var placement = entity.getRef(1);
        if (placement.isPresent()) {
            mesh.transform(PlacementResolver.axis2Placement3D(resolver.resolve(placement.get()), resolver));
        }
        return mesh;
    }

    /**
     * Segments for a sweep of {@code angle} radians: the configured count for a full turn, otherwise 12 per half
     * turn, at least {@value #MIN_SEGMENTS}.
     */
    int segments(double angle) {
        if (Math.abs(angle) >= FULL_TURN) {
            return fullTurnSegments;
        }
        return Math.max(MIN_SEGMENTS, (int) Math.ceil(Math.abs(angle) / Math.PI * fullTurnSegments / 2.0));
    }
}
