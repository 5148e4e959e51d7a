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
package org.walkmesh4j.mesh;

import org.walkmesh4j.IntArrayList;
import org.walkmesh4j.surface.SurfaceMaterial;

import java.util.HashMap;
import java.util.Map;

import static org.walkmesh4j.Vectors.distSqr;

/**
 * Welds coincident boundary edges into adjacency links.
 * <p>
 * Two edges match when their endpoints coincide within a tolerance, in either order. Only edges of walkable faces
 * take part: a link between a walkable face and a blocked one, or between two blocked ones, is never created.
 * Edges are hashed by their quantized midpoint, so only edges in neighbouring cells are compared.
 */
public class EdgeMatcher {

    private final float[] vertices;
    private final int[] faces;
    private final int[] materials;
    private final float tolerance;
    private final float toleranceSqr;
    private final float cellSize;

    public EdgeMatcher(float[] vertices, int[] faces, int[] materials, float tolerance) {
        if (!(tolerance >= 0) || Float.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Weld tolerance must be a finite value >= 0, got " + tolerance);
        }
        this.vertices = vertices;
        this.faces = faces;
        this.materials = materials;
        this.tolerance = tolerance;
        this.toleranceSqr = tolerance * tolerance;
        this.cellSize = Math.max(tolerance * 2f, 1e-4f);
    }

    /**
     * Links every open edge ({@link WalkMesh#NO_NEIGHBOUR}) of a walkable face to a matching open edge of another
     * walkable face, updating {@code adjacency} in place on both sides. Edges are visited in face/edge order and
     * each takes the lowest matching candidate, so the result is deterministic.
     *
     * @param groups optional group per face; when given, only faces of different groups are linked
     * @return the number of links created
     */
    public int weld(int[] adjacency, int[] groups) {
        int faceCount = faces.length / 3;
        Map<Long, IntArrayList> buckets = new HashMap<>();
        IntArrayList open = new IntArrayList();
        for (int f = 0; f < faceCount; f++) {
            if (!SurfaceMaterial.isWalkable(materials[f])) {
                continue;
            }
            for (int e = 0; e < 3; e++) {
                int code = f * 3 + e;
                if (adjacency[code] != WalkMesh.NO_NEIGHBOUR || isDegenerate(f, e)) {
                    continue;
                }
                open.add(code);
                buckets.computeIfAbsent(cellKey(cell(f, e, 0), cell(f, e, 1), cell(f, e, 2)),
                        k -> new IntArrayList(2)).add(code);
            }
        }

        int links = 0;
        for (int i = 0; i < open.size(); i++) {
            int code = open.get(i);
            if (adjacency[code] != WalkMesh.NO_NEIGHBOUR) {
                continue;
            }
            int f = code / 3;
            int e = code % 3;
            int match = findMatch(f, e, adjacency, groups, buckets);
            if (match >= 0) {
                adjacency[code] = match;
                adjacency[match] = code;
                links++;
            }
        }
        return links;
    }

    private int findMatch(int f, int e, int[] adjacency, int[] groups, Map<Long, IntArrayList> buckets) {
        int cx = cell(f, e, 0);
        int cy = cell(f, e, 1);
        int cz = cell(f, e, 2);
        int best = -1;
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                for (int dz = -1; dz <= 1; dz++) {
                    IntArrayList bucket = buckets.get(cellKey(cx + dx, cy + dy, cz + dz));
                    if (bucket == null) {
                        continue;
                    }
                    for (int j = 0; j < bucket.size(); j++) {
                        int other = bucket.get(j);
                        int of = other / 3;
                        if (of == f || adjacency[other] != WalkMesh.NO_NEIGHBOUR) {
                            continue;
                        }
                        if (groups != null && groups[of] == groups[f]) {
                            continue;
                        }
                        if ((best < 0 || other < best) && edgesCoincide(f, e, of, other % 3)) {
                            best = other;
                        }
                    }
                }
            }
        }
        return best;
    }

    private int vertexOffset(int f, int slot) {
        return faces[f * 3 + slot % 3] * 3;
    }

    private boolean isDegenerate(int f, int e) {
        return distSqr(vertices, vertexOffset(f, e), vertexOffset(f, e + 1)) <= toleranceSqr;
    }

    boolean edgesCoincide(int fa, int ea, int fb, int eb) {
        int a0 = vertexOffset(fa, ea);
        int a1 = vertexOffset(fa, ea + 1);
        int b0 = vertexOffset(fb, eb);
        int b1 = vertexOffset(fb, eb + 1);
        if (distSqr(vertices, a0, b1) <= toleranceSqr && distSqr(vertices, a1, b0) <= toleranceSqr) {
            return true;
        }
        return distSqr(vertices, a0, b0) <= toleranceSqr && distSqr(vertices, a1, b1) <= toleranceSqr;
    }

    private int cell(int f, int e, int axis) {
        float mid = (vertices[vertexOffset(f, e) + axis] + vertices[vertexOffset(f, e + 1) + axis]) * 0.5f;
        return (int) Math.floor(mid / cellSize);
    }

    private static long cellKey(int x, int y, int z) {
        // Large multiplicative constants; collisions only add candidates that fail the exact test.
        return ((long) x * 73856093L) ^ ((long) y * 19349663L) ^ ((long) z * 83492791L);
    }

    public float tolerance() {
        return tolerance;
    }
}
