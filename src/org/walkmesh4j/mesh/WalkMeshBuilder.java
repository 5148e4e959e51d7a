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

import org.jetbrains.annotations.NotNull;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static org.walkmesh4j.geom.WalkmeshCommon.faceNormal;
import static org.walkmesh4j.geom.WalkmeshCommon.planeDistance;

/**
 * Validates raw walkmesh arrays and builds an immutable {@link WalkMesh}: derives normals, plane offsets and
 * adjacency where they are missing and builds the AABB tree for spatially indexed categories.
 */
public class WalkMeshBuilder {

    private static final Logger log = LoggerFactory.getLogger(WalkMeshBuilder.class);

    /**
     * Brute-force meshes above this size are suspicious: an area mesh loaded with the wrong category still reports
     * correct walkability but loses its spatial index.
     */
    static final int LARGE_UNINDEXED_FACE_COUNT = 256;

    private WalkMeshBuilder() {
    }

    /**
     * @throws IllegalArgumentException if the arrays are missing, have inconsistent lengths, contain non-finite
     *                                  positions or reference vertices or faces that do not exist
     */
    @NotNull
    public static WalkMesh build(@NotNull WalkMeshParams params) {
        if (params.vertices == null || params.faces == null || params.materials == null) {
            throw new IllegalArgumentException("Walkmesh params need vertices, faces and materials");
        }
        if (params.category == null) {
            throw new IllegalArgumentException("Walkmesh params need a category");
        }
        if (params.vertices.length % 3 != 0) {
            throw new IllegalArgumentException("Vertex array length " + params.vertices.length + " is not a multiple of 3");
        }
        if (params.faces.length % 3 != 0) {
            throw new IllegalArgumentException("Face array length " + params.faces.length + " is not a multiple of 3");
        }
        int vertexCount = params.vertices.length / 3;
        int faceCount = params.faces.length / 3;
        if (params.materials.length != faceCount) {
            throw new IllegalArgumentException("Expected " + faceCount + " materials, got " + params.materials.length);
        }
        for (int i = 0; i < params.vertices.length; i++) {
            if (!Float.isFinite(params.vertices[i])) {
                throw new IllegalArgumentException("Vertex " + i / 3 + " has a non-finite coordinate");
            }
        }
        for (int i = 0; i < params.faces.length; i++) {
            int v = params.faces[i];
            if (v < 0 || v >= vertexCount) {
                throw new IllegalArgumentException("Face " + i / 3 + " references vertex " + v + " of " + vertexCount);
            }
        }

        float[] vertices = Arrays.copyOf(params.vertices, params.vertices.length);
        int[] faces = Arrays.copyOf(params.faces, params.faces.length);
        int[] materials = Arrays.copyOf(params.materials, faceCount);

        float[] normals;
        float[] planeDistances;
        if (params.normals != null || params.planeDistances != null) {
            if (params.normals == null || params.planeDistances == null) {
                throw new IllegalArgumentException("Normals and plane distances must be supplied together");
            }
            if (params.normals.length != faceCount * 3 || params.planeDistances.length != faceCount) {
                throw new IllegalArgumentException("Expected " + faceCount + " normals and plane distances, got "
                        + params.normals.length / 3 + " and " + params.planeDistances.length);
            }
            for (int i = 0; i < params.normals.length; i++) {
                if (!Float.isFinite(params.normals[i])) {
                    throw new IllegalArgumentException("Normal of face " + i / 3 + " has a non-finite component");
                }
            }
            for (int i = 0; i < faceCount; i++) {
                if (!Float.isFinite(params.planeDistances[i])) {
                    throw new IllegalArgumentException("Plane distance of face " + i + " is not finite");
                }
            }
            normals = Arrays.copyOf(params.normals, params.normals.length);
            planeDistances = Arrays.copyOf(params.planeDistances, faceCount);
        } else {
            normals = new float[faceCount * 3];
            planeDistances = new float[faceCount];
            calcPlanes(vertices, faces, normals, planeDistances);
        }

        int[] adjacency;
        if (params.adjacency != null) {
            adjacency = checkAdjacency(params.adjacency, faceCount);
        } else {
            adjacency = new int[faceCount * 3];
            Arrays.fill(adjacency, WalkMesh.NO_NEIGHBOUR);
            int links = new EdgeMatcher(vertices, faces, materials, params.weldTolerance).weld(adjacency, null);
            log.debug("Derived {} adjacency links for {} faces", links, faceCount);
        }

        AABBTree tree = null;
        if (params.category.spatiallyIndexed) {
            tree = AABBTreeBuilder.build(vertices, faces);
            if (tree == null) {
                log.warn("{} walkmesh has no faces; every query will come back empty", params.category);
            }
        } else if (faceCount > LARGE_UNINDEXED_FACE_COUNT) {
            log.warn("{} walkmesh with {} faces has no spatial index; queries will scan every face. "
                    + "Check the category if this is area geometry.", params.category, faceCount);
        }

        log.debug("Built {} walkmesh: {} vertices, {} faces, tree={}", params.category, vertexCount, faceCount,
                tree != null);
        return new WalkMesh(vertices, faces, materials, normals, planeDistances, adjacency, params.category, tree);
    }

    static void calcPlanes(float[] vertices, int[] faces, float[] normals, float[] planeDistances) {
        Vector3f n = new Vector3f();
        for (int f = 0; f < faces.length / 3; f++) {
            int a = faces[f * 3] * 3;
            faceNormal(vertices, a, faces[f * 3 + 1] * 3, faces[f * 3 + 2] * 3, n);
            normals[f * 3] = n.x;
            normals[f * 3 + 1] = n.y;
            normals[f * 3 + 2] = n.z;
            planeDistances[f] = planeDistance(n, vertices, a);
        }
    }

    /**
     * Range-checks supplied adjacency and drops links that are not returned by the neighbour.
     */
    private static int[] checkAdjacency(int[] source, int faceCount) {
        if (source.length != faceCount * 3) {
            throw new IllegalArgumentException("Expected " + faceCount * 3 + " adjacency entries, got " + source.length);
        }
        for (int i = 0; i < source.length; i++) {
            int v = source[i];
            if (v != WalkMesh.NO_NEIGHBOUR && (v < 0 || v >= faceCount * 3)) {
                throw new IllegalArgumentException("Adjacency entry " + i + " of face " + i / 3 + " is out of range: " + v);
            }
        }
        int[] adjacency = Arrays.copyOf(source, source.length);
        int dropped = 0;
        for (int i = 0; i < adjacency.length; i++) {
            int v = source[i];
            if (v != WalkMesh.NO_NEIGHBOUR && (source[v] != i || v / 3 == i / 3)) {
                adjacency[i] = WalkMesh.NO_NEIGHBOUR;
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} one-way adjacency links", dropped);
        }
        return adjacency;
    }
}
