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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.walkmesh4j.Vectors.*;

/**
 * Builds an {@link AABBTree} by recursive top-down splitting.
 * <p>
 * Children are appended to the arena before their parent, so a node never has to be patched once it is stored
 * and the root is always the last node appended.
 */
public class AABBTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(AABBTreeBuilder.class);

    /** Per face: minX, minY, minZ, maxX, maxY, maxZ. */
    private final float[] faceBounds;
    /** Per face centroid. */
    private final float[] centroids;
    private final List<AABBNode> nodes = new ArrayList<>();
    private int depth;

    private AABBTreeBuilder(float[] vertices, int[] faces) {
        int faceCount = faces.length / 3;
        faceBounds = new float[faceCount * 6];
        centroids = new float[faceCount * 3];
        Vector3f bmin = new Vector3f();
        Vector3f bmax = new Vector3f();
        for (int f = 0; f < faceCount; f++) {
            int a = faces[f * 3] * 3;
            int b = faces[f * 3 + 1] * 3;
            int c = faces[f * 3 + 2] * 3;
            copy(bmin, vertices, a);
            copy(bmax, vertices, a);
            min(bmin, vertices, b);
            max(bmax, vertices, b);
            min(bmin, vertices, c);
            max(bmax, vertices, c);
            copy(faceBounds, f * 6, bmin);
            copy(faceBounds, f * 6 + 3, bmax);
            for (int k = 0; k < 3; k++) {
                centroids[f * 3 + k] = (vertices[a + k] + vertices[b + k] + vertices[c + k]) / 3f;
            }
        }
    }

    /**
     * Builds a tree over every face of the mesh.
     *
     * @return the tree, or null if there are no faces
     */
    public static AABBTree build(float[] vertices, int[] faces) {
        int faceCount = faces.length / 3;
        int[] all = new int[faceCount];
        for (int i = 0; i < faceCount; i++) {
            all[i] = i;
        }
        return build(vertices, faces, all);
    }

    /**
     * Builds a tree over a subset of faces.
     *
     * @return the tree, or null if {@code faceIndices} is empty
     */
    public static AABBTree build(float[] vertices, int[] faces, int[] faceIndices) {
        if (faceIndices.length == 0) {
            return null;
        }
        AABBTreeBuilder builder = new AABBTreeBuilder(vertices, faces);
        int[] items = Arrays.copyOf(faceIndices, faceIndices.length);
        int root = builder.subdivide(items, 0, items.length, 1);
        log.debug("Built AABB tree: {} faces, {} nodes, depth {}", items.length, builder.nodes.size(), builder.depth);
        return new AABBTree(builder.nodes.toArray(new AABBNode[0]), root, builder.depth, vertices, faces);
    }

    private int append(AABBNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    private int subdivide(int[] items, int start, int end, int level) {
        depth = Math.max(depth, level);
        int count = end - start;
        if (count == 1) {
            // Leaf
            int face = items[start];
            return append(AABBNode.leaf(Arrays.copyOfRange(faceBounds, face * 6, face * 6 + 6), face));
        }

        // Split
        float[] box = calcExtends(items, start, end);
        int axis = longestAxis(box[3] - box[0], box[4] - box[1], box[5] - box[2]);
        int split = -1;
        for (int attempt = 0; attempt < 3 && split < 0; attempt++) {
            int a = (axis + attempt) % 3;
            split = partition(items, start, end, a, (box[a] + box[a + 3]) * 0.5f);
            if (split < 0) {
                split = medianSplit(items, start, end, a);
            }
        }
        if (split < 0) {
            // Every centroid coincides; any halving is as good as another.
            split = start + count / 2;
        }

        int left = subdivide(items, start, split, level + 1);
        int right = subdivide(items, split, end, level + 1);
        return append(AABBNode.internal(nodes.get(left), left, nodes.get(right), right));
    }

    /// Union box of the faces in items[start, end), as minX, minY, minZ, maxX, maxY, maxZ.
    private float[] calcExtends(int[] items, int start, int end) {
        int f = items[start] * 6;
        float[] box = Arrays.copyOfRange(faceBounds, f, f + 6);
        for (int i = start + 1; i < end; i++) {
            f = items[i] * 6;
            for (int k = 0; k < 3; k++) {
                box[k] = Math.min(box[k], faceBounds[f + k]);
                box[k + 3] = Math.max(box[k + 3], faceBounds[f + k + 3]);
            }
        }
        return box;
    }

    private static int longestAxis(float x, float y, float z) {
        int axis = 0;
        float maxVal = x;
        if (y > maxVal) {
            axis = 1;
            maxVal = y;
        }
        return z > maxVal ? 2 : axis;
    }

    /**
     * Stable partition of items[start, end) into centroids below {@code pivot} followed by the rest.
     *
     * @return the split index, or -1 if one side would be empty
     */
    private int partition(int[] items, int start, int end, int axis, float pivot) {
        IntArrayList below = new IntArrayList(end - start);
        IntArrayList above = new IntArrayList(end - start);
        for (int i = start; i < end; i++) {
            if (centroids[items[i] * 3 + axis] < pivot) {
                below.add(items[i]);
            } else {
                above.add(items[i]);
            }
        }
        if (below.isEmpty() || above.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < below.size(); i++) {
            items[start + i] = below.get(i);
        }
        for (int i = 0; i < above.size(); i++) {
            items[start + below.size() + i] = above.get(i);
        }
        return start + below.size();
    }

    /**
     * Sorts items[start, end) by centroid on {@code axis} and splits at the median centroid value.
     *
     * @return the split index, or -1 if the lower half would be empty
     */
    private int medianSplit(int[] items, int start, int end, int axis) {
        Integer[] sorted = new Integer[end - start];
        for (int i = start; i < end; i++) {
            sorted[i - start] = items[i];
        }
        Arrays.sort(sorted, Comparator.<Integer>comparingDouble(f -> centroids[f * 3 + axis])
                .thenComparingInt(f -> f));
        for (int i = start; i < end; i++) {
            items[i] = sorted[i - start];
        }
        float median = centroids[items[start + (end - start) / 2] * 3 + axis];
        int split = start;
        while (split < end && centroids[items[split] * 3 + axis] < median) {
            split++;
        }
        return split == start ? -1 : split;
    }
}
