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

import com.hellblazer.stepwise.parser.AttributeValue;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point2d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector2d;
import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Reads IFC placement entities into affine transforms.
 * <p>
 * Matrices map local coordinates to the parent frame; their columns are the local X, Y and Z axes and the origin.
 * Optional attributes take IFC defaults: a missing axis is +Z, a missing reference direction +X, a missing scale 1.
 *
 * @author hal.hildebrand
 */
public final class PlacementResolver {
    public static final  String IFCAXIS1PLACEMENT   = "IFCAXIS1PLACEMENT";
    public static final  String IFCAXIS2PLACEMENT2D = "IFCAXIS2PLACEMENT2D";
    public static final  String IFCAXIS2PLACEMENT3D = "IFCAXIS2PLACEMENT3D";
    public static final  String IFCLOCALPLACEMENT   = "IFCLOCALPLACEMENT";
    public static final  String IFCTRANSFORM3D      = "IFCCARTESIANTRANSFORMATIONOPERATOR3D";
    public static final  String IFCTRANSFORM3D_NU   = "IFCCARTESIANTRANSFORMATIONOPERATOR3DNONUNIFORM";
    /**
     * Local placement chains deeper than this are treated as cyclic.
     */
    public static final  int    MAX_PLACEMENT_DEPTH = 256;
    private static final Logger log                 = LoggerFactory.getLogger(PlacementResolver.class);
    private static final double EPSILON             = 1e-12;

    private PlacementResolver() {
    }

    /**
     * IFCAXIS2PLACEMENT3D: Location 0, Axis 1, RefDirection 2. The reference direction is made orthogonal to the
     * axis: {@code y = z × x}, then {@code x = y × z}.
     */
    public static Matrix4d axis2Placement3D(DecodedEntity placement, EntityResolver resolver) {
        var location = placement.getRef(0).map(id -> point(id, resolver)).orElseGet(Point3d::new);
        var z = placement.getRef(1).map(id -> direction(id, resolver)).orElseGet(() -> new Vector3d(0, 0, 1));
        var x = placement.getRef(2).map(id -> direction(id, resolver)).orElseGet(() -> new Vector3d(1, 0, 0));
        return frame(location, z, x);
    }

    /**
     * IFCAXIS2PLACEMENT2D as the origin and X axis of a planar rotation: Location 0, RefDirection 1.
     */
    public static Placement2D axis2Placement2D(DecodedEntity placement, EntityResolver resolver) {
        var location = placement.getRef(0).map(id -> point(id, resolver)).orElseGet(Point3d::new);
        var x = placement.getRef(1).map(id -> direction2D(id, resolver)).orElseGet(() -> new Vector2d(1, 0));
        return new Placement2D(new Point2d(location.x, location.y), x);
    }

    /**
     * Coordinates of an IFCCARTESIANPOINT; missing ordinates are 0.
     */
    public static Point3d point(EntityId id, EntityResolver resolver) {
        var point = resolver.resolve(id);
        return coordinates(point.requireList(0, "Coordinates"), 0.0);
    }

    /**
     * Ordinates of one coordinate tuple, such as an IFCCARTESIANPOINT or an entry of a point list.
     *
     * @param defaultZ value used when the tuple has only two ordinates
     */
    public static Point3d coordinates(List<AttributeValue> ordinates, double defaultZ) {
        return new Point3d(ordinate(ordinates, 0, 0.0), ordinate(ordinates, 1, 0.0),
                           ordinate(ordinates, 2, defaultZ));
    }

    /**
     * Ratios of an IFCDIRECTION, normalized. A missing Z ratio is taken as 1.
     *
     * @throws StepException.InvalidAttribute for a zero length direction
     */
    public static Vector3d direction(EntityId id, EntityResolver resolver) {
        var v = new Vector3d(coordinates(resolver.resolve(id).requireList(0, "DirectionRatios"), 1.0));
        if (v.length() < EPSILON) {
            throw new StepException.InvalidAttribute(id, 0, "zero length direction");
        }
        v.normalize();
        return v;
    }

    /**
     * The first two ratios of an IFCDIRECTION, normalized.
     *
     * @throws StepException.InvalidAttribute for a zero length direction
     */
    public static Vector2d direction2D(EntityId id, EntityResolver resolver) {
        var ratios = resolver.resolve(id).requireList(0, "DirectionRatios");
        var v = new Vector2d(ordinate(ratios, 0, 0.0), ordinate(ratios, 1, 0.0));
        if (v.length() < EPSILON) {
            throw new StepException.InvalidAttribute(id, 0, "zero length direction");
        }
        v.normalize();
        return v;
    }

    /**
     * Compose an IFCLOCALPLACEMENT (PlacementRelTo 0, RelativePlacement 1) with all of its ancestors into a world
     * transform.
     *
     * @throws StepException.InvalidAttribute if the chain is cyclic
     */
    public static Matrix4d localPlacement(EntityId id, EntityResolver resolver) {
        var world = new Matrix4d();
        world.setIdentity();
        var current = id;
        for (int depth = 0; current != null; depth++) {
            if (depth >= MAX_PLACEMENT_DEPTH) {
                throw new StepException.InvalidAttribute(id, 0,
                                                         String.format("placement chain deeper than %d, likely cyclic",
                                                                       MAX_PLACEMENT_DEPTH));
            }
            var placement = resolver.resolve(current);
            var local = placement(placement, resolver);
            // parent frames apply after the child's
            local.mul(world);
            world = local;
            current = placement.isType(IFCLOCALPLACEMENT) ? placement.getRef(0).orElse(null) : null;
        }
        return world;
    }

    /**
     * The transform of any supported placement entity, ignoring a local placement's parents.
     */
    public static Matrix4d placement(DecodedEntity placement, EntityResolver resolver) {
        switch (placement.getTypeName()) {
            case IFCLOCALPLACEMENT:
                return placement.getRef(1)
                                .map(ref -> placement(resolver.resolve(ref), resolver))
                                .orElseGet(PlacementResolver::identity);
            case IFCAXIS2PLACEMENT3D:
                return axis2Placement3D(placement, resolver);
            case IFCAXIS2PLACEMENT2D:
                var planar = axis2Placement2D(placement, resolver);
                return frame(new Point3d(planar.origin().x, planar.origin().y, 0), new Vector3d(0, 0, 1),
                             new Vector3d(planar.xAxis().x, planar.xAxis().y, 0));
            case IFCTRANSFORM3D:
            case IFCTRANSFORM3D_NU:
                return transformationOperator(placement, resolver);
            default:
                log.debug("Unsupported placement {} treated as identity", placement.getTypeName());
                return identity();
        }
    }

    /**
     * IFCCARTESIANTRANSFORMATIONOPERATOR3D: Axis1 0, Axis2 1, LocalOrigin 2, Scale 3, Axis3 4; the non uniform variant
     * adds Scale2 5 and Scale3 6, each defaulting to Scale. Axis2 only chooses the sense of Y; one opposing
     * {@code Axis3 × Axis1} makes the operator a reflection.
     */
    public static Matrix4d transformationOperator(DecodedEntity operator, EntityResolver resolver) {
        var origin = operator.getRef(2).map(id -> point(id, resolver)).orElseGet(Point3d::new);
        var axis1 = operator.getRef(0).map(id -> direction(id, resolver)).orElseGet(() -> new Vector3d(1, 0, 0));
        var axis3 = operator.getRef(4).map(id -> direction(id, resolver)).orElseGet(() -> new Vector3d(0, 0, 1));
        var scale = operator.getFloat(3).orElse(1.0);
        var scaleY = scale;
        var scaleZ = scale;
        if (operator.isType(IFCTRANSFORM3D_NU)) {
            scaleY = operator.getFloat(5).orElse(scale);
            scaleZ = operator.getFloat(6).orElse(scale);
        }
        var m = frame(origin, axis3, axis1);
        var axis2 = operator.getRef(1).map(id -> direction(id, resolver));
        if (axis2.isPresent() && axis2.get().x * m.m01 + axis2.get().y * m.m11 + axis2.get().z * m.m21 < 0) {
            scaleY = -scaleY;
        }
        m.m00 *= scale;
        m.m10 *= scale;
        m.m20 *= scale;
        m.m01 *= scaleY;
        m.m11 *= scaleY;
        m.m21 *= scaleY;
        m.m02 *= scaleZ;
        m.m12 *= scaleZ;
        m.m22 *= scaleZ;
        return m;
    }

    static Matrix4d identity() {
        var m = new Matrix4d();
        m.setIdentity();
        return m;
    }

    private static Matrix4d frame(Point3d location, Vector3d axis, Vector3d refDirection) {
        var z = new Vector3d(axis);
        z.normalize();
        var y = new Vector3d();
        y.cross(z, refDirection);
        if (y.length() < EPSILON) {
            // reference parallel to the axis: any perpendicular will do
            var fallback = Math.abs(z.x) < 0.9 ? new Vector3d(1, 0, 0) : new Vector3d(0, 1, 0);
            y.cross(z, fallback);
        }
        y.normalize();
        var x = new Vector3d();
        x.cross(y, z);
        x.normalize();
        return new Matrix4d(x.x, y.x, z.x, location.x, x.y, y.y, z.y, location.y, x.z, y.z, z.z, location.z, 0, 0, 0,
                            1);
    }

    private static double ordinate(List<AttributeValue> ordinates, int index, double defaultValue) {
        return index < ordinates.size() ? ordinates.get(index).asDouble().orElse(defaultValue) : defaultValue;
    }

    /**
     * A planar placement: origin and unit X axis; Y is X turned a quarter counter clockwise.
     */
    public record Placement2D(Point2d origin, Vector2d xAxis) {
    }
}
