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

import org.jetbrains.annotations.Nullable;
import org.joml.Matrix4f;
import org.joml.Vector3f;
import org.walkmesh4j.IntArrayList;
import org.walkmesh4j.surface.SurfaceMaterial;

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalInt;

import static org.walkmesh4j.Vectors.isFinite;
import static org.walkmesh4j.Vectors.isFinite2D;
import static org.walkmesh4j.geom.WalkmeshCommon.*;

/**
 * An immutable triangle walkmesh: vertices, faces, surface materials, face planes and edge adjacency, plus an
 * optional {@link AABBTree}.
 * <p>
 * Meshes of a spatially indexed {@link MeshCategory} answer point and ray queries through the tree. Meshes built
 * without a tree answer the same queries by scanning every face, which is linear in the face count.
 * <p>
 * Queries never throw on bad input: invalid indices and non-finite coordinates give "not walkable", empty
 * results or false. All queries are read-only, so a mesh can be shared between threads.
 * <p>
 * Edge {@code e} of a face runs from its vertex slot {@code e} to slot {@code (e + 1) % 3}. Adjacency entries
 * are packed as {@code neighbourFace * 3 + neighbourEdge}.
 */
public class WalkMesh {

    /** Adjacency value of an edge with no neighbouring face. */
    public static final int NO_NEIGHBOUR = -1;

    private final float[] vertices;
    private final int[] faces;
    private final int[] materials;
    private final float[] normals;
    private final float[] planeDistances;
    private final int[] adjacency;
    private final float[] centroids;
    private final MeshCategory category;
    @Nullable
    private final AABBTree tree;

    WalkMesh(float[] vertices, int[] faces, int[] materials, float[] normals, float[] planeDistances,
             int[] adjacency, MeshCategory category, @Nullable AABBTree tree) {
        this.vertices = vertices;
        this.faces = faces;
        this.materials = materials;
        this.normals = normals;
        this.planeDistances = planeDistances;
        this.adjacency = adjacency;
        this.category = category;
        this.tree = tree;
        centroids = new float[faces.length];
        Vector3f c = new Vector3f();
        for (int f = 0; f < faces.length / 3; f++) {
            centroid(vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3, faces[f * 3 + 2] * 3, c);
            centroids[f * 3] = c.x;
            centroids[f * 3 + 1] = c.y;
            centroids[f * 3 + 2] = c.z;
        }
    }

    public int getVertexCount() {
        return vertices.length / 3;
    }

    public int getFaceCount() {
        return faces.length / 3;
    }

    public MeshCategory getCategory() {
        return category;
    }

    public boolean hasTree() {
        return tree != null;
    }

    @Nullable
    public AABBTree getTree() {
        return tree;
    }

    public boolean isValidFace(int face) {
        return face >= 0 && face < faces.length / 3;
    }

    /**
     * @return whether the face exists and its material is walkable
     */
    public boolean isWalkable(int face) {
        return isValidFace(face) && SurfaceMaterial.isWalkable(materials[face]);
    }

    /**
     * @return the material id of the face, or -1 if there is no such face
     */
    public int getSurfaceMaterial(int face) {
        return isValidFace(face) ? materials[face] : -1;
    }

    /**
     * Finds the walkable face under (x, y).
     */
    public OptionalInt findFaceAt(float x, float y) {
        return findFaceAt(x, y, true);
    }

    /**
     * Finds the face whose x/y projection contains the point. When several do, the smallest face index wins.
     *
     * @param walkableOnly ignore faces that are not walkable
     */
    public OptionalInt findFaceAt(float x, float y, boolean walkableOnly) {
        if (!isFinite2D(x, y)) {
            return OptionalInt.empty();
        }
        if (tree == null) {
            return scanFaceAt(x, y, walkableOnly);
        }
        int f = tree.findFaceAt(x, y, walkableOnly ? this::isWalkable : face -> true);
        return f < 0 ? OptionalInt.empty() : OptionalInt.of(f);
    }

    /**
     * Linear-scan version of {@link #findFaceAt(float, float, boolean)}, ignoring the tree.
     */
    public OptionalInt scanFaceAt(float x, float y, boolean walkableOnly) {
        if (!isFinite2D(x, y)) {
            return OptionalInt.empty();
        }
        for (int f = 0; f < faces.length / 3; f++) {
            if (walkableOnly && !isWalkable(f)) {
                continue;
            }
            if (pointInTriangle2D(x, y, vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3, faces[f * 3 + 2] * 3)) {
                return OptionalInt.of(f);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isPointWalkable(float x, float y) {
        return findFaceAt(x, y, true).isPresent();
    }

    /**
     * Drops (x, y) onto the walkable surface.
     *
     * @return the surface point, or empty if no walkable face lies under (x, y)
     */
    public Optional<Vector3f> projectToSurface(float x, float y) {
        OptionalInt face = findFaceAt(x, y, true);
        if (face.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Vector3f(x, y, heightOnFace(face.getAsInt(), x, y)));
    }

    /**
     * Height of the surface under (x, y), on any face whether walkable or not.
     */
    public Optional<Float> determineZ(float x, float y) {
        OptionalInt face = findFaceAt(x, y, false);
        if (face.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(heightOnFace(face.getAsInt(), x, y));
    }

    /**
     * Height of a face's plane at (x, y), whether or not the point lies inside the face.
     */
    public Optional<Float> getHeightOnFace(int face, float x, float y) {
        if (!isValidFace(face) || !isFinite2D(x, y)) {
            return Optional.empty();
        }
        return Optional.of(heightOnFace(face, x, y));
    }

    private float heightOnFace(int f, float x, float y) {
        return planeHeight(x, y, normals[f * 3], normals[f * 3 + 1], normals[f * 3 + 2], planeDistances[f],
                vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3, faces[f * 3 + 2] * 3);
    }

    /**
     * Finds the nearest face, walkable or not, hit by a ray.
     *
     * @param direction   ray direction; need not be normalized
     * @param maxDistance hits further than this are ignored
     */
    public Optional<RaycastHit> raycast(Vector3f origin, Vector3f direction, float maxDistance) {
        Vector3f dir = rayDirection(origin, direction, maxDistance);
        if (dir == null) {
            return Optional.empty();
        }
        if (tree == null) {
            return Optional.ofNullable(scanRaycastHit(origin, dir, maxDistance));
        }
        return Optional.ofNullable(tree.raycast(origin, dir, maxDistance));
    }

    /**
     * Linear-scan version of {@link #raycast(Vector3f, Vector3f, float)}, ignoring the tree.
     */
    public Optional<RaycastHit> scanRaycast(Vector3f origin, Vector3f direction, float maxDistance) {
        Vector3f dir = rayDirection(origin, direction, maxDistance);
        if (dir == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(scanRaycastHit(origin, dir, maxDistance));
    }

    private RaycastHit scanRaycastHit(Vector3f origin, Vector3f dir, float maxDistance) {
        int bestFace = -1;
        float bestDist = maxDistance;
        for (int f = 0; f < faces.length / 3; f++) {
            float t = intersectRayTriangle(origin, dir, vertices, faces[f * 3] * 3, faces[f * 3 + 1] * 3,
                    faces[f * 3 + 2] * 3, bestDist);
            if (t >= 0 && (bestFace < 0 || t < bestDist)) {
                bestDist = t;
                bestFace = f;
            }
        }
        if (bestFace < 0) {
            return null;
        }
        return new RaycastHit(bestFace, bestDist, new Vector3f(dir).mul(bestDist).add(origin));
    }

    private static Vector3f rayDirection(Vector3f origin, Vector3f direction, float maxDistance) {
        if (!isFinite(origin) || !isFinite(direction) || !(maxDistance > 0) || Float.isNaN(maxDistance)) {
            return null;
        }
        float len = direction.length();
        if (!(len > 1e-12f) || !Float.isFinite(len)) {
            return null;
        }
        return new Vector3f(direction).div(len);
    }

    /**
     * @return the face across the given edge, or empty for a boundary edge or invalid input
     */
    public OptionalInt getNeighbour(int face, int edge) {
        if (!isValidFace(face) || edge < 0 || edge > 2) {
            return OptionalInt.empty();
        }
        int f = getNeighbourUnsafe(face, edge);
        return f < 0 ? OptionalInt.empty() : OptionalInt.of(f);
    }

    /**
     * Like {@link #getNeighbour(int, int)} without range checks.
     *
     * @return the neighbouring face or {@link #NO_NEIGHBOUR}
     */
    public int getNeighbourUnsafe(int face, int edge) {
        int v = adjacency[face * 3 + edge];
        return v == NO_NEIGHBOUR ? NO_NEIGHBOUR : v / 3;
    }

    /**
     * @return the raw adjacency entry for (face, edge), or {@link #NO_NEIGHBOUR} for invalid input
     */
    public int getAdjacencyEntry(int face, int edge) {
        if (!isValidFace(face) || edge < 0 || edge > 2) {
            return NO_NEIGHBOUR;
        }
        return adjacency[face * 3 + edge];
    }

    /**
     * @return the faces sharing an edge with {@code face}, in edge order
     */
    public int[] getAdjacentFaces(int face) {
        if (!isValidFace(face)) {
            return new int[0];
        }
        IntArrayList result = new IntArrayList(3);
        for (int e = 0; e < 3; e++) {
            int n = getNeighbourUnsafe(face, e);
            if (n != NO_NEIGHBOUR) {
                result.add(n);
            }
        }
        return result.toArray();
    }

    public Optional<Vector3f> getFaceCenter(int face) {
        if (!isValidFace(face)) {
            return Optional.empty();
        }
        return Optional.of(getFaceCenterUnsafe(face, new Vector3f()));
    }

    public Vector3f getFaceCenterUnsafe(int face, Vector3f out) {
        return out.set(centroids[face * 3], centroids[face * 3 + 1], centroids[face * 3 + 2]);
    }

    public Vector3f getEdgeMidpointUnsafe(int face, int edge, Vector3f out) {
        int a = faces[face * 3 + edge] * 3;
        int b = faces[face * 3 + (edge + 1) % 3] * 3;
        return out.set((vertices[a] + vertices[b]) * 0.5f, (vertices[a + 1] + vertices[b + 1]) * 0.5f,
                (vertices[a + 2] + vertices[b + 2]) * 0.5f);
    }

    /**
     * Tests whether a walker can move in a straight line from {@code from} to {@code to} (in x/y) without leaving
     * walkable ground. The segment is followed face by face through adjacency; it is blocked where it crosses a
     * boundary edge or enters a face that is not walkable.
     */
    public boolean hasLineOfSight(Vector3f from, Vector3f to) {
        if (!isFinite(from) || !isFinite(to)) {
            return false;
        }
        OptionalInt start = findFaceAt(from.x, from.y, true);
        if (start.isEmpty()) {
            return false;
        }
        int face = start.getAsInt();
        int prev = NO_NEIGHBOUR;
        for (int steps = 0; steps <= faces.length / 3; steps++) {
            int a = faces[face * 3] * 3;
            int b = faces[face * 3 + 1] * 3;
            int c = faces[face * 3 + 2] * 3;
            if (pointInTriangle2D(to.x, to.y, vertices, a, b, c)) {
                return true;
            }
            IntersectResult clip = intersectSegmentTriangle2D(from.x, from.y, to.x, to.y, vertices, a, b, c);
            if (!clip.intersects) {
                return false;
            }
            if (clip.exitEdge < 0) {
                return true;
            }
            int next = getNeighbourUnsafe(face, clip.exitEdge);
            if (next == NO_NEIGHBOUR || next == prev || !isWalkable(next)) {
                return false;
            }
            prev = face;
            face = next;
        }
        return false;
    }

    public WalkMeshStats getStats() {
        int walkable = 0;
        int boundary = 0;
        for (int f = 0; f < faces.length / 3; f++) {
            if (isWalkable(f)) {
                walkable++;
            }
            for (int e = 0; e < 3; e++) {
                if (adjacency[f * 3 + e] == NO_NEIGHBOUR) {
                    boundary++;
                }
            }
        }
        return new WalkMeshStats(getVertexCount(), getFaceCount(), walkable, boundary,
                tree == null ? 0 : tree.size(), tree == null ? 0 : tree.depth());
    }

    /**
     * Returns a copy of this mesh with every vertex transformed by {@code matrix}. Materials and adjacency carry
     * over unchanged; a mirroring transform swaps two vertices of every face so that winding and normals still
     * face up, and remaps the adjacency edge numbers to match.
     */
    public WalkMesh transform(Matrix4f matrix) {
        WalkMeshParams params = new WalkMeshParams();
        params.category = category;
        params.materials = getMaterials();
        params.vertices = new float[vertices.length];
        Vector3f p = new Vector3f();
        for (int i = 0; i < vertices.length; i += 3) {
            matrix.transformPosition(p.set(vertices[i], vertices[i + 1], vertices[i + 2]));
            params.vertices[i] = p.x;
            params.vertices[i + 1] = p.y;
            params.vertices[i + 2] = p.z;
        }
        params.faces = getFaces();
        params.adjacency = getAdjacency();
        if (matrix.determinant3x3() < 0) {
            // Swapping slots 1 and 2 maps edge 0 <-> 2 and keeps edge 1.
            int[] remap = {2, 1, 0};
            for (int f = 0; f < faces.length / 3; f++) {
                params.faces[f * 3 + 1] = faces[f * 3 + 2];
                params.faces[f * 3 + 2] = faces[f * 3 + 1];
                for (int e = 0; e < 3; e++) {
                    int v = adjacency[f * 3 + e];
                    params.adjacency[f * 3 + remap[e]] = v == NO_NEIGHBOUR ? NO_NEIGHBOUR : (v / 3) * 3 + remap[v % 3];
                }
            }
        }
        return WalkMeshBuilder.build(params);
    }

    public float[] getVertices() {
        return Arrays.copyOf(vertices, vertices.length);
    }

    public int[] getFaces() {
        return Arrays.copyOf(faces, faces.length);
    }

    public int[] getMaterials() {
        return Arrays.copyOf(materials, materials.length);
    }

    public float[] getNormals() {
        return Arrays.copyOf(normals, normals.length);
    }

    public float[] getPlaneDistances() {
        return Arrays.copyOf(planeDistances, planeDistances.length);
    }

    public int[] getAdjacency() {
        return Arrays.copyOf(adjacency, adjacency.length);
    }
}
