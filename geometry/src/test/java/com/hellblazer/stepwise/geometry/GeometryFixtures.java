/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry;

import com.hellblazer.stepwise.parser.ParsedModel;
import com.hellblazer.stepwise.parser.StepModel;
import com.hellblazer.stepwise.parser.StepParser;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author hal.hildebrand
 */
public final class GeometryFixtures {
    public static final double EPSILON = 1e-5;

    private GeometryFixtures() {
    }

    /**
     * Every triangle's normal points away from the mesh centroid. Only meaningful for convex closed meshes.
     */
    public static void assertOutward(Mesh mesh) {
        var bounds = mesh.bounds().orElseThrow();
        var center = bounds.center();
        var indices = mesh.getIndices();
        for (int t = 0; t < indices.size(); t += 3) {
            var a = mesh.getPosition(indices.getInt(t));
            var b = mesh.getPosition(indices.getInt(t + 1));
            var c = mesh.getPosition(indices.getInt(t + 2));
            var ab = new Vector3d();
            ab.sub(b, a);
            var ac = new Vector3d();
            ac.sub(c, a);
            var n = new Vector3d();
            n.cross(ab, ac);
            if (n.length() < 1e-12) {
                continue;
            }
            var centroid = new Point3d((a.x + b.x + c.x) / 3, (a.y + b.y + c.y) / 3, (a.z + b.z + c.z) / 3);
            var out = new Vector3d();
            out.sub(centroid, center);
            assertTrue(n.dot(out) > 0, "Triangle " + t / 3 + " faces inward: " + a + " " + b + " " + c);
        }
    }

    public static void assertPoint(double x, double y, double z, Point3d actual) {
        assertEquals(x, actual.x, EPSILON, "x of " + actual);
        assertEquals(y, actual.y, EPSILON, "y of " + actual);
        assertEquals(z, actual.z, EPSILON, "z of " + actual);
    }

    public static String load(String resource) {
        try (var in = GeometryFixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Volume enclosed by a closed mesh, positive when its faces point outward.
     */
    public static double signedVolume(Mesh mesh) {
        var volume = 0.0;
        var indices = mesh.getIndices();
        for (int t = 0; t < indices.size(); t += 3) {
            var a = mesh.getPosition(indices.getInt(t));
            var b = mesh.getPosition(indices.getInt(t + 1));
            var c = mesh.getPosition(indices.getInt(t + 2));
            volume += a.x * (b.y * c.z - b.z * c.y) - a.y * (b.x * c.z - b.z * c.x) + a.z * (b.x * c.y - b.y * c.x);
        }
        return volume / 6.0;
    }

    public static StepModel model(String records) {
        return StepModel.scan(records);
    }

    public static ParsedModel mixedGeometry() {
        return new StepParser().parse(load("/mixed-geometry.ifc"));
    }

    public static ParsedModel simpleWall() {
        return new StepParser().parse(load("/simple-wall.ifc"));
    }
}
