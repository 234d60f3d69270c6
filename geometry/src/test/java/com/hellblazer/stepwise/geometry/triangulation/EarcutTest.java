/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.triangulation;

import com.hellblazer.stepwise.common.IntArrayList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class EarcutTest {

    private static double triangleArea(double[] data, IntArrayList triangles, int t) {
        int a = triangles.getInt(t) * 2, b = triangles.getInt(t + 1) * 2, c = triangles.getInt(t + 2) * 2;
        return ((data[b] - data[a]) * (data[c + 1] - data[a + 1]) - (data[c] - data[a]) * (data[b + 1] - data[a + 1]))
        / 2;
    }

    private static double totalArea(double[] data, IntArrayList triangles) {
        var sum = 0.0;
        for (int t = 0; t < triangles.size(); t += 3) {
            var area = triangleArea(data, triangles, t);
            assertTrue(area > 0, "triangle " + t / 3 + " is not counter clockwise");
            sum += area;
        }
        return sum;
    }

    @Test
    void testClockwiseInputStillCounterClockwiseOutput() {
        var data = new double[] { 0, 0, 0, 1, 1, 1, 1, 0 };
        var triangles = Earcut.triangulate(data, new int[0]);
        assertEquals(6, triangles.size());
        assertEquals(1.0, totalArea(data, triangles), 1e-9);
    }

    @Test
    void testComb() {
        // three teeth pointing up from a base strip
        var data = new double[] { 0, 0, 5, 0, 5, 3, 4, 3, 4, 1, 3, 1, 3, 3, 2, 3, 2, 1, 1, 1, 1, 3, 0, 3 };
        var triangles = Earcut.triangulate(data, new int[0]);
        assertEquals((12 - 2) * 3, triangles.size());
        assertEquals(5 + 3 * 2, totalArea(data, triangles), 1e-9);
    }

    @Test
    void testDegenerateRing() {
        assertTrue(Earcut.triangulate(new double[] { 0, 0, 1, 1 }, new int[0]).isEmpty());
    }

    @Test
    void testSignedArea() {
        var ccw = new double[] { 0, 0, 2, 0, 2, 2, 0, 2 };
        assertEquals(8.0, Earcut.signedArea(ccw, 0, ccw.length), 1e-12);
        var cw = new double[] { 0, 0, 0, 2, 2, 2, 2, 0 };
        assertEquals(-8.0, Earcut.signedArea(cw, 0, cw.length), 1e-12);
    }

    @Test
    void testTwoHoles() {
        var data = new double[] { 0, 0, 10, 0, 10, 10, 0, 10, // outer
                                  1, 1, 3, 1, 3, 3, 1, 3, // hole
                                  6, 6, 8, 6, 8, 8, 6, 8 // hole
        };
        var triangles = Earcut.triangulate(data, new int[] { 4, 8 });
        // n + 2h - 2 triangles for n total vertices and h holes
        assertEquals((12 + 4 - 2) * 3, triangles.size());
        assertEquals(100 - 4 - 4, totalArea(data, triangles), 1e-9);
    }
}
