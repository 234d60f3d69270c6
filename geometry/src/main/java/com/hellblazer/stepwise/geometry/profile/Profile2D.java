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

import com.hellblazer.stepwise.common.IntArrayList;
import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.triangulation.Triangulation;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A planar cross section in the XY plane of its owning solid: an outer loop wound counter clockwise and any number of
 * holes wound clockwise. Loops are open; the last point connects back to the first.
 * <p>
 * Factory methods normalize winding, so callers may supply loops in either orientation.
 *
 * @author hal.hildebrand
 */
public final class Profile2D {
    public static final int MIN_CIRCLE_SEGMENTS = 8;
    public static final int MAX_CIRCLE_SEGMENTS = 32;

    private final ProfileType         type;
    private final List<Point2d>       outer;
    private final List<List<Point2d>> holes = new ArrayList<>();

    private Profile2D(ProfileType type, List<Point2d> outer) {
        this.type = type;
        this.outer = outer;
    }

    /**
     * Segments used to approximate a circle of the given radius: {@code ceil(sqrt(r) * 8)} clamped to
     * [{@value #MIN_CIRCLE_SEGMENTS}, {@value #MAX_CIRCLE_SEGMENTS}].
     */
    public static int calculateCircleSegments(double radius) {
        return calculateCircleSegments(radius, MIN_CIRCLE_SEGMENTS, MAX_CIRCLE_SEGMENTS);
    }

    public static int calculateCircleSegments(double radius, int minSegments, int maxSegments) {
        var segments = (int) Math.ceil(Math.sqrt(Math.max(radius, 0)) * 8.0);
        return Math.max(minSegments, Math.min(maxSegments, segments));
    }

    public static Profile2D circle(double radius) {
        return circle(radius, calculateCircleSegments(radius));
    }

    /**
     * Circle centered on the origin, first vertex on +X.
     *
     * @throws GeometryException.Profile if the radius is not positive or fewer than 3 segments are requested
     */
    public static Profile2D circle(double radius, int segments) {
        if (!(radius > 0)) {
            throw new GeometryException.Profile(String.format("circle radius must be positive: %s", radius));
        }
        return new Profile2D(ProfileType.CIRCLE, circlePoints(radius, segments));
    }

    /**
     * Annulus; the inner circle is sampled with its own segment count.
     *
     * @throws GeometryException.Profile unless {@code 0 < innerRadius < outerRadius}
     */
    public static Profile2D hollowCircle(double outerRadius, double innerRadius, int minSegments, int maxSegments) {
        if (!(innerRadius > 0) || innerRadius >= outerRadius) {
            throw new GeometryException.Profile(
            String.format("hollow circle needs 0 < inner < outer radius: inner %s, outer %s", innerRadius,
                          outerRadius));
        }
        var profile = circle(outerRadius, calculateCircleSegments(outerRadius, minSegments, maxSegments));
        var hole = circlePoints(innerRadius, calculateCircleSegments(innerRadius, minSegments, maxSegments));
        Collections.reverse(hole);
        var hollow = new Profile2D(ProfileType.HOLLOW_CIRCLE, profile.outer);
        hollow.holes.add(hole);
        return hollow;
    }

    /**
     * @throws GeometryException.Profile for fewer than 3 points
     */
    public static Profile2D polygon(List<Point2d> points) {
        return new Profile2D(ProfileType.ARBITRARY, wound(points, true, "outer loop"));
    }

    /**
     * Rectangle centered on the origin.
     *
     * @throws GeometryException.Profile if either dimension is not positive
     */
    public static Profile2D rectangle(double width, double height) {
        if (!(width > 0) || !(height > 0)) {
            throw new GeometryException.Profile(
            String.format("rectangle dimensions must be positive: %s x %s", width, height));
        }
        var hw = width / 2.0;
        var hh = height / 2.0;
        var points = new ArrayList<Point2d>(4);
        points.add(new Point2d(-hw, -hh));
        points.add(new Point2d(hw, -hh));
        points.add(new Point2d(hw, hh));
        points.add(new Point2d(-hw, hh));
        return new Profile2D(ProfileType.RECTANGLE, points);
    }

    private static double area(List<Point2d> loop) {
        return Triangulation.signedArea(loop) / 2.0;
    }

    private static List<Point2d> circlePoints(double radius, int segments) {
        if (segments < 3) {
            throw new GeometryException.Profile(String.format("circle needs at least 3 segments: %s", segments));
        }
        var points = new ArrayList<Point2d>(segments);
        for (int i = 0; i < segments; i++) {
            var angle = 2.0 * Math.PI * i / segments;
            points.add(new Point2d(radius * Math.cos(angle), radius * Math.sin(angle)));
        }
        return points;
    }

    private static boolean onSegment(Point2d p, Point2d a, Point2d b) {
        var cross = (b.x - a.x) * (p.y - a.y) - (b.y - a.y) * (p.x - a.x);
        var length = a.distance(b);
        if (Math.abs(cross) > Triangulation.MIN_AREA * Math.max(1.0, length)) {
            return false;
        }
        return p.x >= Math.min(a.x, b.x) - 1e-12 && p.x <= Math.max(a.x, b.x) + 1e-12
               && p.y >= Math.min(a.y, b.y) - 1e-12 && p.y <= Math.max(a.y, b.y) + 1e-12;
    }

    private static List<Point2d> wound(List<Point2d> points, boolean counterClockwise, String what) {
        if (points.size() < 3) {
            throw new GeometryException.Profile(
            String.format("%s needs at least 3 points, found %d", what, points.size()));
        }
        var copy = new ArrayList<Point2d>(points.size());
        for (var p : points) {
            copy.add(new Point2d(p));
        }
        if (Triangulation.signedArea(copy) > 0 != counterClockwise) {
            Collections.reverse(copy);
        }
        return copy;
    }

    /**
     * Add a hole, stored clockwise.
     *
     * @throws GeometryException.Profile for fewer than 3 points
     */
    public void addHole(List<Point2d> points) {
        holes.add(wound(points, false, "hole"));
    }

    /**
     * Every point of the profile: the outer loop followed by each hole, the index space of {@link #triangulate()}.
     */
    public List<Point2d> allPoints() {
        var all = new ArrayList<Point2d>(vertexCount());
        all.addAll(outer);
        holes.forEach(all::addAll);
        return all;
    }

    /**
     * @return the enclosed area, outer loop minus holes
     */
    public double area() {
        var total = area(outer);
        for (var hole : holes) {
            total -= Math.abs(area(hole));
        }
        return total;
    }

    /**
     * @return true if {@code point} lies strictly inside the outer loop, boundary excluded; holes are ignored
     */
    public boolean contains(Point2d point) {
        var inside = false;
        var n = outer.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            var a = outer.get(i);
            var b = outer.get(j);
            if (onSegment(point, a, b)) {
                return false;
            }
            if ((a.y > point.y) != (b.y > point.y) && point.x < (b.x - a.x) * (point.y - a.y) / (b.y - a.y) + a.x) {
                inside = !inside;
            }
        }
        return inside;
    }

    public List<List<Point2d>> getHoles() {
        return Collections.unmodifiableList(holes);
    }

    public List<Point2d> getOuter() {
        return Collections.unmodifiableList(outer);
    }

    public ProfileType getType() {
        return type;
    }

    public boolean hasHoles() {
        return !holes.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Profile2D[%s, %d points, %d holes]", type, outer.size(), holes.size());
    }

    /**
     * Place the profile: each point {@code p} maps to {@code origin + p.x * xAxis + p.y * yAxis} where yAxis is xAxis
     * turned a quarter counter clockwise. A rotation, so winding is preserved.
     *
     * @return a new profile of the same type
     */
    public Profile2D transformed(Point2d origin, Vector2d xAxis) {
        var x = new Vector2d(xAxis);
        if (x.length() < Triangulation.MIN_AREA) {
            x.set(1, 0);
        }
        x.normalize();
        var placed = new Profile2D(type, place(outer, origin, x));
        for (var hole : holes) {
            placed.holes.add(place(hole, origin, x));
        }
        return placed;
    }

    /**
     * Indices, three per triangle, into {@link #allPoints()}; triangles wind counter clockwise.
     */
    public IntArrayList triangulate() {
        return Triangulation.triangulatePolygonWithHoles(outer, holes);
    }

    public int vertexCount() {
        var count = outer.size();
        for (var hole : holes) {
            count += hole.size();
        }
        return count;
    }

    /**
     * A copy with {@code extra} added as holes.
     */
    Profile2D withHoles(List<List<Point2d>> extra) {
        var copy = new Profile2D(type, outer);
        copy.holes.addAll(holes);
        for (var hole : extra) {
            copy.addHole(hole);
        }
        return copy;
    }

    private List<Point2d> place(List<Point2d> loop, Point2d origin, Vector2d x) {
        var placed = new ArrayList<Point2d>(loop.size());
        for (var p : loop) {
            placed.add(new Point2d(origin.x + x.x * p.x - x.y * p.y, origin.y + x.y * p.x + x.x * p.y));
        }
        return placed;
    }
}
