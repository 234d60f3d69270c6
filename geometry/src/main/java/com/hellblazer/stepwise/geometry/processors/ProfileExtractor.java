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

import com.hellblazer.stepwise.geometry.GeometryConfig;
import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.profile.Profile2D;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link Profile2D}s from IFC profile definitions and reads the points of polyline curves.
 * <p>
 * Parameterized profiles are centered on the origin of their own Position (attribute 2, an IFCAXIS2PLACEMENT2D) when
 * one is given. Arbitrary profiles take their coordinates from the curve as written.
 *
 * @author hal.hildebrand
 */
public final class ProfileExtractor {
    public static final  String IFCARBITRARYCLOSEDPROFILEDEF    = "IFCARBITRARYCLOSEDPROFILEDEF";
    public static final  String IFCARBITRARYPROFILEDEFWITHVOIDS = "IFCARBITRARYPROFILEDEFWITHVOIDS";
    public static final  String IFCCIRCLEHOLLOWPROFILEDEF       = "IFCCIRCLEHOLLOWPROFILEDEF";
    public static final  String IFCCIRCLEPROFILEDEF             = "IFCCIRCLEPROFILEDEF";
    public static final  String IFCINDEXEDPOLYCURVE             = "IFCINDEXEDPOLYCURVE";
    public static final  String IFCISHAPEPROFILEDEF             = "IFCISHAPEPROFILEDEF";
    public static final  String IFCLSHAPEPROFILEDEF             = "IFCLSHAPEPROFILEDEF";
    public static final  String IFCPOLYLINE                     = "IFCPOLYLINE";
    public static final  String IFCRECTANGLEPROFILEDEF          = "IFCRECTANGLEPROFILEDEF";
    public static final  String IFCTSHAPEPROFILEDEF             = "IFCTSHAPEPROFILEDEF";
    private static final double CLOSING_TOLERANCE               = 1e-10;
    private static final Logger log                             = LoggerFactory.getLogger(ProfileExtractor.class);

    private final int minCircleSegments;
    private final int maxCircleSegments;

    public ProfileExtractor(GeometryConfig config) {
        this.minCircleSegments = config.getMinCircleSegments();
        this.maxCircleSegments = config.getMaxCircleSegments();
    }

    private static void dropClosingPoint(List<Point2d> points) {
        if (points.size() > 1) {
            var first = points.get(0);
            var last = points.get(points.size() - 1);
            if (Math.abs(first.x - last.x) < CLOSING_TOLERANCE && Math.abs(first.y - last.y) < CLOSING_TOLERANCE) {
                points.remove(points.size() - 1);
            }
        }
    }

    private static void positive(DecodedEntity profile, double value, String what) {
        if (!(value > 0)) {
            throw new GeometryException.Profile(
            String.format("%s of %s must be positive: %s", what, profile.getId(), value));
        }
    }

    /**
     * Points of an IFCPOLYLINE or IFCINDEXEDPOLYCURVE in the XY plane, without a duplicated closing point.
     *
     * @throws GeometryException.UnsupportedType for any other curve
     */
    public List<Point2d> curvePoints2D(EntityId curveId, EntityResolver resolver) {
        var points3d = curvePoints(resolver.resolve(curveId), resolver);
        var points = new ArrayList<Point2d>(points3d.size());
        for (var p : points3d) {
            points.add(new Point2d(p.x, p.y));
        }
        dropClosingPoint(points);
        return points;
    }

    /**
     * Points of an IFCPOLYLINE or IFCINDEXEDPOLYCURVE; 2D points lie at z = 0. A closed curve keeps its closing point,
     * which is what a swept path needs.
     *
     * @throws GeometryException.UnsupportedType for any other curve
     */
    public List<Point3d> curvePoints3D(EntityId curveId, EntityResolver resolver) {
        return curvePoints(resolver.resolve(curveId), resolver);
    }

    /**
     * @throws GeometryException.UnsupportedType for profile definitions other than rectangle, circle, hollow circle,
     *                                           arbitrary closed, arbitrary with voids, I, L and T shapes
     * @throws GeometryException.Profile         for non positive dimensions or degenerate curves
     */
    public Profile2D extract(DecodedEntity profile, EntityResolver resolver) {
        switch (profile.getTypeName()) {
            case IFCARBITRARYCLOSEDPROFILEDEF:
                return Profile2D.polygon(curvePoints2D(profile.requireRef(2, "OuterCurve"), resolver));
            case IFCARBITRARYPROFILEDEFWITHVOIDS:
                return withVoids(profile, resolver);
            default:
                return placed(profile, parameterized(profile), resolver);
        }
    }

    private List<Point3d> curvePoints(DecodedEntity curve, EntityResolver resolver) {
        var points = new ArrayList<Point3d>();
        switch (curve.getTypeName()) {
            case IFCPOLYLINE:
                for (var ref : curve.getRefs(0)) {
                    points.add(PlacementResolver.point(ref, resolver));
                }
                if (points.isEmpty()) {
                    throw new StepException.InvalidAttribute(curve.getId(), 0, "polyline without points");
                }
                break;
            case IFCINDEXEDPOLYCURVE: {
                var pointList = resolver.resolve(curve.requireRef(0, "Points"));
                for (var coordinate : pointList.requireList(0, "CoordList")) {
                    coordinate.asList().ifPresent(ordinates -> points.add(PlacementResolver.coordinates(ordinates, 0.0)));
                }
                if (curve.getList(1).isPresent()) {
                    log.debug("Segments of {} ignored, reading its points as a polyline", curve.getId());
                }
                break;
            }
            default:
                throw new GeometryException.UnsupportedType(curve.getTypeName());
        }
        return points;
    }

    private Profile2D parameterized(DecodedEntity profile) {
        switch (profile.getTypeName()) {
            case IFCRECTANGLEPROFILEDEF:
                return Profile2D.rectangle(profile.requireFloat(3, "XDim"), profile.requireFloat(4, "YDim"));
            case IFCCIRCLEPROFILEDEF: {
                var radius = profile.requireFloat(3, "Radius");
                positive(profile, radius, "Radius");
                return Profile2D.circle(radius,
                                        Profile2D.calculateCircleSegments(radius, minCircleSegments,
                                                                          maxCircleSegments));
            }
            case IFCCIRCLEHOLLOWPROFILEDEF: {
                var radius = profile.requireFloat(3, "Radius");
                var wall = profile.requireFloat(4, "WallThickness");
                if (!(radius - wall > 0)) {
                    throw new GeometryException.Profile(
                    String.format("hollow circle %s has inner radius <= 0: radius %s, wall %s", profile.getId(),
                                  radius, wall));
                }
                return Profile2D.hollowCircle(radius, radius - wall, minCircleSegments, maxCircleSegments);
            }
            case IFCISHAPEPROFILEDEF:
                return iShape(profile);
            case IFCLSHAPEPROFILEDEF:
                return lShape(profile);
            case IFCTSHAPEPROFILEDEF:
                return tShape(profile);
            default:
                throw new GeometryException.UnsupportedType(profile.getTypeName());
        }
    }

    private Profile2D iShape(DecodedEntity profile) {
        var width = profile.requireFloat(3, "OverallWidth");
        var depth = profile.requireFloat(4, "OverallDepth");
        var web = profile.requireFloat(5, "WebThickness");
        var flange = profile.requireFloat(6, "FlangeThickness");
        positive(profile, width, "OverallWidth");
        positive(profile, depth, "OverallDepth");
        positive(profile, web, "WebThickness");
        positive(profile, flange, "FlangeThickness");
        var hw = width / 2.0;
        var hd = depth / 2.0;
        var hwt = web / 2.0;
        return Profile2D.polygon(
        List.of(new Point2d(-hw, -hd), new Point2d(hw, -hd), new Point2d(hw, -hd + flange),
                new Point2d(hwt, -hd + flange), new Point2d(hwt, hd - flange), new Point2d(hw, hd - flange),
                new Point2d(hw, hd), new Point2d(-hw, hd), new Point2d(-hw, hd - flange),
                new Point2d(-hwt, hd - flange), new Point2d(-hwt, -hd + flange), new Point2d(-hw, -hd + flange)));
    }

    private Profile2D lShape(DecodedEntity profile) {
        var depth = profile.requireFloat(3, "Depth");
        var width = profile.getFloat(4).orElse(depth);
        var thickness = profile.requireFloat(5, "Thickness");
        positive(profile, depth, "Depth");
        positive(profile, width, "Width");
        positive(profile, thickness, "Thickness");
        return Profile2D.polygon(
        List.of(new Point2d(0, 0), new Point2d(width, 0), new Point2d(width, thickness),
                new Point2d(thickness, thickness), new Point2d(thickness, depth), new Point2d(0, depth)));
    }

    private Profile2D placed(DecodedEntity definition, Profile2D profile, EntityResolver resolver) {
        var position = definition.getRef(2);
        if (position.isEmpty()) {
            return profile;
        }
        var placement = PlacementResolver.axis2Placement2D(resolver.resolve(position.get()), resolver);
        return profile.transformed(placement.origin(), placement.xAxis());
    }

    private Profile2D tShape(DecodedEntity profile) {
        var depth = profile.requireFloat(3, "Depth");
        var flangeWidth = profile.requireFloat(4, "FlangeWidth");
        var web = profile.requireFloat(5, "WebThickness");
        var flange = profile.requireFloat(6, "FlangeThickness");
        positive(profile, depth, "Depth");
        positive(profile, flangeWidth, "FlangeWidth");
        positive(profile, web, "WebThickness");
        positive(profile, flange, "FlangeThickness");
        var hfw = flangeWidth / 2.0;
        var hwt = web / 2.0;
        return Profile2D.polygon(
        List.of(new Point2d(-hfw, 0), new Point2d(hfw, 0), new Point2d(hfw, flange), new Point2d(hwt, flange),
                new Point2d(hwt, depth), new Point2d(-hwt, depth), new Point2d(-hwt, flange),
                new Point2d(-hfw, flange)));
    }

    private Profile2D withVoids(DecodedEntity profile, EntityResolver resolver) {
        var result = Profile2D.polygon(curvePoints2D(profile.requireRef(2, "OuterCurve"), resolver));
        for (var inner : profile.getRefs(3)) {
            var hole = curvePoints2D(inner, resolver);
            if (hole.size() < 3) {
                log.warn("Inner curve {} of {} has {} points, skipped", inner, profile.getId(), hole.size());
                continue;
            }
            result.addHole(hole);
        }
        return result;
    }
}
