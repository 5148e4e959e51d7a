/*
Copyright (c) 2009-2010 Mikko Mononen memon@inside.org
recast4j copyright (c) 2015-2019 Piotr Piastucki piotr@jtilia.org

This software is provided 'as-is', without any express or implied
warranty.  In no event will the authors be held liable for any damages
arising from the use of this software.
Permission is granted to anyone to use this software for any purpose,
including commercial applications, and to alter it and redistribute it
freely, subject to the following restrictions:
1. The origin of this software must not be misrepresented; you must not
 claim that you wrote the original software. If you use this software
 in a product, an acknowledgment in the product documentation would be
 appreciated but is not required.
2. Altered source versions must be plainly marked as such, and must not be
 misrepresented as being the original software.
3. This notice may not be removed or altered from any source distribution.
*/
package org.walkmesh4j.geom;

import org.joml.Intersectionf;
import org.joml.Vector3f;

/**
 * Stateless geometry helpers for triangles stored in flat vertex arrays.
 * <p>
 * Vertex arguments named {@code a}, {@code b}, {@code c} are offsets into the vertex array (vertex index * 3).
 * "2D" tests work on the x/y plane; z is up and is ignored by them.
 */
public class WalkmeshCommon {

    /** Tolerance, in world units, for a point lying on a triangle edge. */
    static final float EDGE_EPS = 1e-5f;
    /** Twice the x/y area below which a triangle is treated as a line or a point. */
    static final float DEGENERATE_AREA = 1e-10f;
    /** Normal z below which a face counts as vertical for height evaluation. */
    static final float VERTICAL_EPS = 1e-6f;
    static final float RAY_EPS = 1e-9f;

    private WalkmeshCommon() {
    }

    /// Derives the signed x/y area of the triangle ABC, times two.
    /// Positive when ABC winds counter-clockwise seen from +z.
    public static float triArea2D(float[] verts, int a, int b, int c) {
        float abx = verts[b] - verts[a];
        float aby = verts[b + 1] - verts[a + 1];
        float acx = verts[c] - verts[a];
        float acy = verts[c + 1] - verts[a + 1];
        return abx * acy - aby * acx;
    }

    /// Twice the signed area of (A, B, P); positive when P is left of A->B.
    private static float side(float[] verts, int a, int b, float x, float y) {
        return (verts[b] - verts[a]) * (y - verts[a + 1]) - (verts[b + 1] - verts[a + 1]) * (x - verts[a]);
    }

    private static float edgeLength2D(float[] verts, int a, int b) {
        float dx = verts[b] - verts[a];
        float dy = verts[b + 1] - verts[a + 1];
        return (float) Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Tests whether (x, y) lies inside the x/y projection of triangle ABC. Points on an edge count as inside.
     * Either winding is accepted; a triangle with no x/y area contains nothing.
     * <p>
     * The edge slack alone would reach far past a sharp corner, so the point must also lie in the triangle's box
     * padded by the same tolerance {@link #aabbContainsPoint2D} uses.
     */
    public static boolean pointInTriangle2D(float x, float y, float[] verts, int a, int b, int c) {
        float area = triArea2D(verts, a, b, c);
        if (Math.abs(area) < DEGENERATE_AREA) {
            return false;
        }
        float minX = Math.min(verts[a], Math.min(verts[b], verts[c]));
        float minY = Math.min(verts[a + 1], Math.min(verts[b + 1], verts[c + 1]));
        float maxX = Math.max(verts[a], Math.max(verts[b], verts[c]));
        float maxY = Math.max(verts[a + 1], Math.max(verts[b + 1], verts[c + 1]));
        if (!aabbContainsPoint2D(x, y, minX, minY, maxX, maxY)) {
            return false;
        }
        float sign = area > 0 ? 1f : -1f;
        return sign * side(verts, a, b, x, y) >= -EDGE_EPS * edgeLength2D(verts, a, b)
                && sign * side(verts, b, c, x, y) >= -EDGE_EPS * edgeLength2D(verts, b, c)
                && sign * side(verts, c, a, x, y) >= -EDGE_EPS * edgeLength2D(verts, c, a);
    }

    /**
     * Computes the unit normal of triangle ABC into {@code out}.
     *
     * @return false if the triangle is degenerate, in which case {@code out} is zero
     */
    public static boolean faceNormal(float[] verts, int a, int b, int c, Vector3f out) {
        float e0x = verts[b] - verts[a];
        float e0y = verts[b + 1] - verts[a + 1];
        float e0z = verts[b + 2] - verts[a + 2];
        float e1x = verts[c] - verts[a];
        float e1y = verts[c + 1] - verts[a + 1];
        float e1z = verts[c + 2] - verts[a + 2];
        out.set(e0y * e1z - e0z * e1y, e0z * e1x - e0x * e1z, e0x * e1y - e0y * e1x);
        float len = out.length();
        if (len < 1e-12f) {
            out.zero();
            return false;
        }
        out.div(len);
        return true;
    }

    /// Plane offset D for a face with the given normal, so that n . p + D = 0 holds on the plane.
    public static float planeDistance(Vector3f normal, float[] verts, int a) {
        return -(normal.x * verts[a] + normal.y * verts[a + 1] + normal.z * verts[a + 2]);
    }

    /**
     * Evaluates the height of a face plane at (x, y): {@code z = -(A x + B y + D) / C}.
     * <p>
     * A vertical face (C close to zero) has no single height; the mean z of its vertices is returned instead.
     */
    public static float planeHeight(float x, float y, float nx, float ny, float nz, float d, float[] verts, int a,
                                    int b, int c) {
        if (Math.abs(nz) < VERTICAL_EPS) {
            return (verts[a + 2] + verts[b + 2] + verts[c + 2]) / 3f;
        }
        // + 0f turns -0 into 0
        return -(nx * x + ny * y + d) / nz + 0f;
    }

    public static Vector3f centroid(float[] verts, int a, int b, int c, Vector3f out) {
        return out.set((verts[a] + verts[b] + verts[c]) / 3f,
                (verts[a + 1] + verts[b + 1] + verts[c + 1]) / 3f,
                (verts[a + 2] + verts[b + 2] + verts[c + 2]) / 3f);
    }

    /**
     * Intersects a ray with triangle ABC from either side.
     *
     * @param dir         unit-length ray direction, so the result is a distance
     * @param maxDistance hits further away than this are ignored
     * @return the distance to the hit, or -1 if there is no hit in front of the origin within range
     */
    public static float intersectRayTriangle(Vector3f origin, Vector3f dir, float[] verts, int a, int b, int c,
                                             float maxDistance) {
        float t = Intersectionf.intersectRayTriangle(origin.x, origin.y, origin.z, dir.x, dir.y, dir.z,
                verts[a], verts[a + 1], verts[a + 2],
                verts[b], verts[b + 1], verts[b + 2],
                verts[c], verts[c + 1], verts[c + 2], RAY_EPS);
        if (!(t >= 0f) || t > maxDistance) {
            return -1f;
        }
        return t;
    }

    /**
     * Slab test of a ray against an axis-aligned box. Box faces are inclusive so that flat boxes (a single
     * horizontal triangle) can still be hit.
     *
     * @return the distance at which the ray enters the box (0 if the origin is inside), or -1 if it misses
     */
    public static float intersectRayAABB(Vector3f origin, Vector3f dir, float minX, float minY, float minZ,
                                         float maxX, float maxY, float maxZ) {
        float tmin = 0f;
        float tmax = Float.POSITIVE_INFINITY;
        for (int axis = 0; axis < 3; axis++) {
            float o = axis == 0 ? origin.x : axis == 1 ? origin.y : origin.z;
            float d = axis == 0 ? dir.x : axis == 1 ? dir.y : dir.z;
            float lo = axis == 0 ? minX : axis == 1 ? minY : minZ;
            float hi = axis == 0 ? maxX : axis == 1 ? maxY : maxZ;
            if (Math.abs(d) < RAY_EPS) {
                // Parallel to this slab.
                if (o < lo || o > hi) {
                    return -1f;
                }
                continue;
            }
            float inv = 1f / d;
            float t1 = (lo - o) * inv;
            float t2 = (hi - o) * inv;
            if (t1 > t2) {
                float tmp = t1;
                t1 = t2;
                t2 = tmp;
            }
            tmin = Math.max(tmin, t1);
            tmax = Math.min(tmax, t2);
            if (tmin > tmax) {
                return -1f;
            }
        }
        return tmin;
    }

    public static boolean aabbContainsPoint2D(float x, float y, float minX, float minY, float maxX, float maxY) {
        return x >= minX - EDGE_EPS && x <= maxX + EDGE_EPS && y >= minY - EDGE_EPS && y <= maxY + EDGE_EPS;
    }

    /**
     * Result of clipping a 2D segment against a triangle.
     */
    public static class IntersectResult {
        public boolean intersects;
        public float tmin;
        public float tmax = 1f;
        /** Edge through which the segment enters, or -1 if it starts inside. */
        public int entryEdge = -1;
        /** Edge through which the segment leaves, or -1 if it ends inside. */
        public int exitEdge = -1;
    }

    /**
     * Clips the x/y segment P0-P1 against triangle ABC, reporting the parametric interval inside the triangle and
     * the edges crossed. Edge k runs from vertex slot k to slot (k + 1) % 3.
     */
    public static IntersectResult intersectSegmentTriangle2D(float p0x, float p0y, float p1x, float p1y,
                                                             float[] verts, int a, int b, int c) {
        IntersectResult result = new IntersectResult();
        float area = triArea2D(verts, a, b, c);
        if (Math.abs(area) < DEGENERATE_AREA) {
            return result;
        }
        float sign = area > 0 ? 1f : -1f;
        float dx = p1x - p0x;
        float dy = p1y - p0y;
        int[] corners = {a, b, c};
        for (int k = 0; k < 3; k++) {
            int vs = corners[k];
            int ve = corners[(k + 1) % 3];
            float ex = verts[ve] - verts[vs];
            float ey = verts[ve + 1] - verts[vs + 1];
            float n = sign * (ex * (p0y - verts[vs + 1]) - ey * (p0x - verts[vs]));
            float d = sign * (ex * dy - ey * dx);
            float tolerance = EDGE_EPS * (float) Math.sqrt(ex * ex + ey * ey);
            if (Math.abs(d) < 1e-12f) {
                // Segment is parallel to this edge.
                if (n < -tolerance) {
                    return result;
                }
                continue;
            }
            float t = -n / d;
            if (d > 0) {
                // entering across this edge
                if (t > result.tmin) {
                    result.tmin = t;
                    result.entryEdge = k;
                    if (result.tmin > result.tmax) {
                        return result;
                    }
                }
            } else {
                // leaving across this edge
                if (t < result.tmax) {
                    result.tmax = t;
                    result.exitEdge = k;
                    if (result.tmax < result.tmin) {
                        return result;
                    }
                }
            }
        }
        result.intersects = true;
        return result;
    }
}
