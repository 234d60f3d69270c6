/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.profile;

import com.hellblazer.stepwise.geometry.GeometryException;
import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point2d;
import javax.vecmath.Vector3d;
import java.util.List;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertOutward;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertPoint;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ExtrusionTest {

    private static List<Point2d> square(double x, double y, double size) {
        return List.of(new Point2d(x, y), new Point2d(x + size, y), new Point2d(x + size, y + size),
                       new Point2d(x, y + size));
    }

    @Test
    void testApplyTransform() {
        var mesh = Extrusion.extrudeProfile(Profile2D.rectangle(2, 1), 3, null);
        var placement = new Matrix4d();
        placement.rotZ(Math.PI / 2);
        placement.setTranslation(new Vector3d(10, 0, 1));
        Extrusion.applyTransform(mesh, placement);
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(9.5, -1, 1, bounds.min());
        assertPoint(10.5, 1, 4, bounds.max());
        assertOutward(mesh);
    }

    @Test
    void testDownwardExtrusion() {
        var mesh = Extrusion.extrudeProfile(Profile2D.rectangle(2, 1), 3, new Vector3d(0, 0, -1));
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(-1, -0.5, -3, bounds.min());
        assertPoint(1, 0.5, 0, bounds.max());
        assertOutward(mesh);
        // the cap at z = 0 is now the top
        assertEquals(1, mesh.getNormal(0).z, 1e-6);
    }

    @Test
    void testInvalidExtrusions() {
        var rect = Profile2D.rectangle(2, 1);
        assertThrows(GeometryException.Profile.class, () -> Extrusion.extrudeProfile(rect, 0, null));
        assertThrows(GeometryException.Profile.class, () -> Extrusion.extrudeProfile(rect, -1, null));
        assertThrows(GeometryException.Profile.class,
                     () -> Extrusion.extrudeProfile(rect, 1, new Vector3d(0, 0, 0)));
        assertThrows(GeometryException.Profile.class,
                     () -> Extrusion.extrudeProfile(rect, 1, new Vector3d(1, 0, 0)));
    }

    @Test
    void testObliqueExtrusion() {
        var mesh = Extrusion.extrudeProfile(Profile2D.rectangle(2, 1), Math.sqrt(2), new Vector3d(1, 0, 1));
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(-1, -0.5, 0, bounds.min());
        assertPoint(2, 0.5, 1, bounds.max());
        assertEquals(12, mesh.triangleCount());
        assertOutward(mesh);
    }

    @Test
    void testRectangleExtrusion() {
        var mesh = Extrusion.extrudeProfile(Profile2D.rectangle(2, 1), 3, null);
        assertEquals(12, mesh.triangleCount());
        assertEquals(24, mesh.vertexCount());
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(-1, -0.5, 0, bounds.min());
        assertPoint(1, 0.5, 3, bounds.max());
        assertEquals(2 * 2 + 2 * (2 * 3) + 2 * (1 * 3), mesh.area(), 1e-5);
        assertOutward(mesh);
        assertEquals(-1, mesh.getNormal(0).z, 1e-6);
        assertEquals(1, mesh.getNormal(4).z, 1e-6);
    }

    @Test
    void testVoidOutsideProfile() {
        var profile = Profile2D.rectangle(4, 4);
        assertThrows(GeometryException.Csg.class,
                     () -> Extrusion.extrudeProfileWithVoids(profile, 2, null, List.of(square(1, 1, 2))));
        // touching the boundary is not inside
        assertThrows(GeometryException.Csg.class,
                     () -> Extrusion.extrudeProfileWithVoids(profile, 2, null, List.of(square(0, 0, 2))));
    }

    @Test
    void testVoidsCutThrough() {
        var profile = Profile2D.rectangle(4, 4);
        var mesh = Extrusion.extrudeProfileWithVoids(profile, 2, null, List.of(square(-0.5, -0.5, 1)));
        assertFalse(profile.hasHoles());
        // caps 2 * (16 - 1), outer walls 16 * 2, void walls 4 * 2
        assertEquals(30 + 32 + 8, mesh.area(), 1e-4);
        assertEquals(2 * 8 + 4 * 2 + 4 * 2, mesh.triangleCount());
        // a void wall faces into the void
        var indices = mesh.getIndices();
        var last = indices.getInt(indices.size() - 1);
        var p = mesh.getPosition(last);
        var n = mesh.getNormal(last);
        assertTrue(Math.abs(p.x) <= 0.5 + 1e-6 && Math.abs(p.y) <= 0.5 + 1e-6);
        assertTrue(n.x * -p.x + n.y * -p.y > 0);
    }
}
