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
package com.hellblazer.stepwise.geometry.triangulation;

import com.hellblazer.stepwise.common.IntArrayList;

import java.util.ArrayList;
import java.util.Comparator;

/**
 * Ear clipping over a doubly linked vertex ring. Holes are joined to the outer ring by bridge edges, leftmost hole
 * first, before clipping starts. When no ear can be found the ring is cleaned of collinear points, then local self
 * intersections are cut off, and finally the polygon is split along a valid diagonal and each half clipped.
 * <p>
 * The outer ring is processed counter clockwise and holes clockwise whatever their input winding, so every
 * triangle comes out counter clockwise.
 *
 * @author hal.hildebrand
 */
final class Earcut {

    private static final class Node {
        final int    i;
        final double x;
        final double y;
        Node    prev;
        Node    next;
        boolean steiner;

        Node(int i, double x, double y) {
            this.i = i;
            this.x = x;
            this.y = y;
        }
    }

    private Earcut() {
    }

    /**
     * @param data        interleaved x, y coordinates of the outer ring followed by each hole
     * @param holeIndices vertex index at which each hole starts, ascending
     * @return vertex indices, three per triangle
     */
    static IntArrayList triangulate(double[] data, int[] holeIndices) {
        var triangles = new IntArrayList();
        var outerEnd = holeIndices.length > 0 ? holeIndices[0] * 2 : data.length;
        var outer = linkedList(data, 0, outerEnd, true);
        if (outer == null || outer.next == outer.prev) {
            return triangles;
        }
        if (holeIndices.length > 0) {
            outer = eliminateHoles(data, holeIndices, outer);
        }
        earcutLinked(outer, triangles, 0);
        return triangles;
    }

    /**
     * Twice the signed area in the ring's own orientation; positive for counter clockwise.
     */
    static double signedArea(double[] data, int start, int end) {
        var sum = 0.0;
        for (int i = start, j = end - 2; i < end; i += 2) {
            sum += (data[j] - data[i]) * (data[i + 1] + data[j + 1]);
            j = i;
        }
        return sum;
    }

    private static double area(Node p, Node q, Node r) {
        return (q.y - p.y) * (r.x - q.x) - (q.x - p.x) * (r.y - q.y);
    }

    private static Node cureLocalIntersections(Node start, IntArrayList triangles) {
        var p = start;
        do {
            var a = p.prev;
            var b = p.next.next;
            if (!equal(a, b) && intersects(a, p, p.next, b) && locallyInside(a, b) && locallyInside(b, a)) {
                triangles.addTriangle(a.i, p.i, b.i);
                removeNode(p);
                removeNode(p.next);
                p = start = b;
            }
            p = p.next;
        } while (p != start);
        return filterPoints(p, null);
    }

    private static void earcutLinked(Node ear, IntArrayList triangles, int pass) {
        if (ear == null) {
            return;
        }
        var stop = ear;
        while (ear.prev != ear.next) {
            var prev = ear.prev;
            var next = ear.next;
            if (isEar(ear)) {
                triangles.addTriangle(prev.i, ear.i, next.i);
                removeNode(ear);
                ear = next.next;
                stop = next.next;
                continue;
            }
            ear = next;
            if (ear == stop) {
                switch (pass) {
                    case 0 -> earcutLinked(filterPoints(ear, null), triangles, 1);
                    case 1 -> earcutLinked(cureLocalIntersections(filterPoints(ear, null), triangles), triangles, 2);
                    default -> splitEarcut(ear, triangles);
                }
                break;
            }
        }
    }

    private static Node eliminateHole(Node hole, Node outer) {
        var bridge = findHoleBridge(hole, outer);
        if (bridge == null) {
            return outer;
        }
        var bridgeReverse = splitPolygon(bridge, hole);
        var filteredBridge = filterPoints(bridge, bridge.next);
        filterPoints(bridgeReverse, bridgeReverse.next);
        return outer == bridge ? filteredBridge : outer;
    }

    private static Node eliminateHoles(double[] data, int[] holeIndices, Node outer) {
        var queue = new ArrayList<Node>(holeIndices.length);
        for (int h = 0; h < holeIndices.length; h++) {
            var start = holeIndices[h] * 2;
            var end = h < holeIndices.length - 1 ? holeIndices[h + 1] * 2 : data.length;
            var list = linkedList(data, start, end, false);
            if (list == null) {
                continue;
            }
            if (list == list.next) {
                list.steiner = true;
            }
            queue.add(leftmost(list));
        }
        queue.sort(Comparator.comparingDouble(n -> n.x));
        for (var hole : queue) {
            outer = eliminateHole(hole, outer);
        }
        return outer;
    }

    private static boolean equal(Node a, Node b) {
        return a.x == b.x && a.y == b.y;
    }

    private static Node filterPoints(Node start, Node end) {
        if (start == null) {
            return null;
        }
        if (end == null) {
            end = start;
        }
        var p = start;
        boolean again;
        do {
            again = false;
            if (!p.steiner && (equal(p, p.next) || area(p.prev, p, p.next) == 0)) {
                removeNode(p);
                p = end = p.prev;
                if (p == p.next) {
                    break;
                }
                again = true;
            } else {
                p = p.next;
            }
        } while (again || p != end);
        return end;
    }

    /**
     * The outer vertex to connect the hole's leftmost vertex to: the nearest outer edge hit by a ray cast to the
     * left, refined to the visible vertex with the smallest angle to the ray.
     */
    private static Node findHoleBridge(Node hole, Node outer) {
        var p = outer;
        var hx = hole.x;
        var hy = hole.y;
        var qx = Double.NEGATIVE_INFINITY;
        Node m = null;
        do {
            if (hy <= p.y && hy >= p.next.y && p.next.y != p.y) {
                var x = p.x + (hy - p.y) * (p.next.x - p.x) / (p.next.y - p.y);
                if (x <= hx && x > qx) {
                    qx = x;
                    if (x == hx) {
                        if (hy == p.y) {
                            return p;
                        }
                        if (hy == p.next.y) {
                            return p.next;
                        }
                    }
                    m = p.x < p.next.x ? p : p.next;
                }
            }
            p = p.next;
        } while (p != outer);
        if (m == null) {
            return null;
        }
        if (hx == qx) {
            return m;
        }
        var stop = m;
        var mx = m.x;
        var my = m.y;
        var tanMin = Double.POSITIVE_INFINITY;
        p = m;
        do {
            if (hx >= p.x && p.x >= mx && hx != p.x
                && pointInTriangle(hy < my ? hx : qx, hy, mx, my, hy < my ? qx : hx, hy, p.x, p.y)) {
                var tan = Math.abs(hy - p.y) / (hx - p.x);
                var better = tan < tanMin || (tan == tanMin && (p.x > m.x || (p.x == m.x
                                                                              && sectorContainsSector(m, p))));
                if (locallyInside(p, hole) && better) {
                    m = p;
                    tanMin = tan;
                }
            }
            p = p.next;
        } while (p != stop);
        return m;
    }

    private static Node insertNode(int i, double x, double y, Node last) {
        var p = new Node(i, x, y);
        if (last == null) {
            p.prev = p;
            p.next = p;
        } else {
            p.next = last.next;
            p.prev = last;
            last.next.prev = p;
            last.next = p;
        }
        return p;
    }

    private static boolean intersects(Node p1, Node q1, Node p2, Node q2) {
        var o1 = Math.signum(area(p1, q1, p2));
        var o2 = Math.signum(area(p1, q1, q2));
        var o3 = Math.signum(area(p2, q2, p1));
        var o4 = Math.signum(area(p2, q2, q1));
        if (o1 != o2 && o3 != o4) {
            return true;
        }
        return (o1 == 0 && onSegment(p1, p2, q1)) || (o2 == 0 && onSegment(p1, q2, q1))
               || (o3 == 0 && onSegment(p2, p1, q2)) || (o4 == 0 && onSegment(p2, q1, q2));
    }

    private static boolean intersectsPolygon(Node a, Node b) {
        var p = a;
        do {
            if (p.i != a.i && p.next.i != a.i && p.i != b.i && p.next.i != b.i && intersects(p, p.next, a, b)) {
                return true;
            }
            p = p.next;
        } while (p != a);
        return false;
    }

    private static boolean isEar(Node ear) {
        var a = ear.prev;
        var c = ear.next;
        if (area(a, ear, c) >= 0) {
            return false;
        }
        var p = c.next;
        while (p != a) {
            if (pointInTriangle(a.x, a.y, ear.x, ear.y, c.x, c.y, p.x, p.y) && area(p.prev, p, p.next) >= 0) {
                return false;
            }
            p = p.next;
        }
        return true;
    }

    private static boolean isValidDiagonal(Node a, Node b) {
        if (a.next.i == b.i || a.prev.i == b.i || intersectsPolygon(a, b)) {
            return false;
        }
        var visible = locallyInside(a, b) && locallyInside(b, a) && middleInside(a, b);
        if (visible && (area(a.prev, a, b.prev) != 0 || area(a, b.prev, b) != 0)) {
            return true;
        }
        // zero length diagonal between coincident vertices of two convex corners
        return equal(a, b) && area(a.prev, a, a.next) > 0 && area(b.prev, b, b.next) > 0;
    }

    private static Node leftmost(Node start) {
        var p = start;
        var leftmost = start;
        do {
            if (p.x < leftmost.x || (p.x == leftmost.x && p.y < leftmost.y)) {
                leftmost = p;
            }
            p = p.next;
        } while (p != start);
        return leftmost;
    }

    /**
     * Ring over {@code data[start, end)}, oriented counter clockwise when {@code outer}, clockwise otherwise.
     */
    private static Node linkedList(double[] data, int start, int end, boolean outer) {
        Node last = null;
        if (outer == (signedArea(data, start, end) > 0)) {
            for (int i = start; i < end; i += 2) {
                last = insertNode(i / 2, data[i], data[i + 1], last);
            }
        } else {
            for (int i = end - 2; i >= start; i -= 2) {
                last = insertNode(i / 2, data[i], data[i + 1], last);
            }
        }
        if (last != null && equal(last, last.next)) {
            removeNode(last);
            last = last.next;
        }
        return last;
    }

    private static boolean locallyInside(Node a, Node b) {
        return area(a.prev, a, a.next) < 0 ? area(a, b, a.next) >= 0 && area(a, a.prev, b) >= 0
                                           : area(a, b, a.prev) < 0 || area(a, a.next, b) < 0;
    }

    private static boolean middleInside(Node a, Node b) {
        var p = a;
        var inside = false;
        var px = (a.x + b.x) / 2;
        var py = (a.y + b.y) / 2;
        do {
            if ((p.y > py) != (p.next.y > py) && p.next.y != p.y
                && px < (p.next.x - p.x) * (py - p.y) / (p.next.y - p.y) + p.x) {
                inside = !inside;
            }
            p = p.next;
        } while (p != a);
        return inside;
    }

    private static boolean onSegment(Node p, Node q, Node r) {
        return q.x <= Math.max(p.x, r.x) && q.x >= Math.min(p.x, r.x) && q.y <= Math.max(p.y, r.y)
               && q.y >= Math.min(p.y, r.y);
    }

    private static boolean pointInTriangle(double ax, double ay, double bx, double by, double cx, double cy,
                                           double px, double py) {
        return (cx - px) * (ay - py) >= (ax - px) * (cy - py) && (ax - px) * (by - py) >= (bx - px) * (ay - py)
               && (bx - px) * (cy - py) >= (cx - px) * (by - py);
    }

    private static void removeNode(Node p) {
        p.next.prev = p.prev;
        p.prev.next = p.next;
    }

    private static boolean sectorContainsSector(Node m, Node p) {
        return area(m.prev, m, p.prev) < 0 && area(p.next, m, m.next) < 0;
    }

    private static void splitEarcut(Node start, IntArrayList triangles) {
        var a = start;
        do {
            var b = a.next.next;
            while (b != a.prev) {
                if (a.i != b.i && isValidDiagonal(a, b)) {
                    var c = splitPolygon(a, b);
                    a = filterPoints(a, a.next);
                    c = filterPoints(c, c.next);
                    earcutLinked(a, triangles, 0);
                    earcutLinked(c, triangles, 0);
                    return;
                }
                b = b.next;
            }
            a = a.next;
        } while (a != start);
    }

    /**
     * Connect {@code a} and {@code b} with a diagonal. Both halves keep {@code a} and {@code b}; returns the
     * duplicate of {@code b} that starts the second ring.
     */
    private static Node splitPolygon(Node a, Node b) {
        var a2 = new Node(a.i, a.x, a.y);
        var b2 = new Node(b.i, b.x, b.y);
        var an = a.next;
        var bp = b.prev;
        a.next = b;
        b.prev = a;
        a2.next = an;
        an.prev = a2;
        b2.next = a2;
        a2.prev = b2;
        bp.next = b2;
        b2.prev = bp;
        return b2;
    }
}
