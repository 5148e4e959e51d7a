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

import org.joml.Vector3f;
import org.walkmesh4j.IntArrayList;

import java.util.function.IntPredicate;

import static org.walkmesh4j.geom.WalkmeshCommon.*;

/**
 * Bounding volume tree over the faces of a walkmesh, stored as a flat arena of immutable nodes.
 * <p>
 * Queries answer exactly what a linear scan over the same faces would answer; the tree only prunes.
 */
public class AABBTree {

    private final AABBNode[] nodes;
    private final int root;
    private final int depth;
    private final float[] vertices;
    private final int[] faces;

    AABBTree(AABBNode[] nodes, int root, int depth, float[] vertices, int[] faces) {
        this.nodes = nodes;
        this.root = root;
        this.depth = depth;
        this.vertices = vertices;
        this.faces = faces;
    }

    public int root() {
        return root;
    }

    public int size() {
        return nodes.length;
    }

    public int depth() {
        return depth;
    }

    public AABBNode node(int index) {
        return nodes[index];
    }

    /**
     * Finds the smallest face index whose x/y projection contains the point and which passes {@code filter}.
     *
     * @return the face index, or -1
     */
    public int findFaceAt(float x, float y, IntPredicate filter) {
        int best = -1;
        IntArrayList stack = new IntArrayList(Math.max(depth * 2, 16));
        stack.add(root);
        while (!stack.isEmpty()) {
            AABBNode node = nodes[stack.removeLast()];
            if (!aabbContainsPoint2D(x, y, node.minX, node.minY, node.maxX, node.maxY)) {
                continue;
            }
            if (node.isLeaf()) {
                int f = node.face;
                if ((best < 0 || f < best) && containsPoint(f, x, y) && filter.test(f)) {
                    best = f;
                }
            } else {
                stack.add(node.right);
                stack.add(node.left);
            }
        }
        return best;
    }

    /**
     * Finds the nearest face hit by the ray. Subtrees whose box is entered beyond the closest hit so far are
     * skipped. Equal distances resolve to the smaller face index.
     *
     * @param dir unit-length direction
     * @return the hit, or null
     */
    public RaycastHit raycast(Vector3f origin, Vector3f dir, float maxDistance) {
        int bestFace = -1;
        float bestDist = maxDistance;
        IntArrayList stack = new IntArrayList(Math.max(depth * 2, 16));
        stack.add(root);
        while (!stack.isEmpty()) {
            AABBNode node = nodes[stack.removeLast()];
            float entry = intersectRayAABB(origin, dir, node.minX, node.minY, node.minZ, node.maxX, node.maxY,
                    node.maxZ);
            if (entry < 0 || entry > bestDist) {
                continue;
            }
            if (node.isLeaf()) {
                int f = node.face;
                float t = intersectRayTriangle(origin, dir, vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3,
                        faces[f * 3 + 2] * 3, bestDist);
                // t never exceeds bestDist here
                if (t >= 0 && (bestFace < 0 || t < bestDist || f < bestFace)) {
                    bestDist = t;
                    bestFace = f;
                }
            } else {
                stack.add(node.right);
                stack.add(node.left);
            }
        }
        if (bestFace < 0) {
            return null;
        }
        return new RaycastHit(bestFace, bestDist, new Vector3f(dir).mul(bestDist).add(origin));
    }

    private boolean containsPoint(int f, float x, float y) {
        return pointInTriangle2D(x, y, vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3, faces[f * 3 + 2] * 3);
    }
}
