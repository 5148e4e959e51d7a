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

import org.joml.Matrix4f;
import org.joml.Vector3f;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.walkmesh4j.TestMeshes;
import org.walkmesh4j.surface.SurfaceMaterial;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WalkMeshTest {

    private static final int STONE = SurfaceMaterial.STONE.id;
    private static final int NON_WALK = SurfaceMaterial.NON_WALK.id;

    /** 4 x 4 grid with the centre 2 x 2 cells blocked. */
    private static WalkMesh blockedCentre() {
        return TestMeshes.grid(4, f -> {
            int cell = f / 2;
            int i = cell % 4;
            int j = cell / 4;
            return i >= 1 && i <= 2 && j >= 1 && j <= 2 ? NON_WALK : STONE;
        });
    }

    @Test
    void testProjectToSurfaceFollowsSlope() {
        WalkMesh mesh = WalkMeshBuilder.build(TestMeshes.gridParams(5, 0, 0, 1f, 0.5f, 0.25f, f -> STONE));
        Random random = new Random(3);
        for (int i = 0; i < 200; i++) {
            float x = random.nextFloat() * 5f;
            float y = random.nextFloat() * 5f;
            Vector3f p = mesh.projectToSurface(x, y).orElseThrow();
            assertEquals(x, p.x);
            assertEquals(y, p.y);
            assertEquals(1f + 0.5f * x + 0.25f * y, p.z, 1e-4f);
            assertEquals(p.z, mesh.determineZ(x, y).orElseThrow().floatValue(), 1e-6f);
        }
    }

    @Test
    void testOffMeshQueriesAreEmpty() {
        WalkMesh mesh = TestMeshes.flatGrid(2);
        assertTrue(mesh.findFaceAt(-0.5f, 1f).isEmpty());
        assertTrue(mesh.projectToSurface(3f, 3f).isEmpty());
        assertTrue(mesh.determineZ(2.5f, 0f).isEmpty());
        assertFalse(mesh.isPointWalkable(10f, 10f));
        assertTrue(mesh.findFaceAt(Float.NaN, 1f).isEmpty());
        assertTrue(mesh.projectToSurface(1f, Float.POSITIVE_INFINITY).isEmpty());
        assertTrue(mesh.raycast(new Vector3f(1, 1, 5), new Vector3f(0, 0, 0), 10f).isEmpty());
        assertTrue(mesh.raycast(new Vector3f(1, 1, Float.NaN), new Vector3f(0, 0, -1), 10f).isEmpty());
        assertTrue(mesh.raycast(new Vector3f(1, 1, 5), new Vector3f(0, 0, -1), -1f).isEmpty());
    }

    @Test
    @DisplayName("Points on shared edges and vertices resolve to the smallest face index")
    void testSharedEdgesResolveDeterministically() {
        WalkMesh mesh = TestMeshes.flatGrid(4);
        assertEquals(OptionalInt.of(0), mesh.findFaceAt(0.5f, 0.5f));
        assertEquals(OptionalInt.of(0), mesh.findFaceAt(1f, 0.5f));
        assertEquals(OptionalInt.of(0), mesh.findFaceAt(1f, 1f));
        assertEquals(OptionalInt.of(0), mesh.findFaceAt(0f, 0f));
        assertEquals(OptionalInt.of(30), mesh.findFaceAt(4f, 4f));

        WalkMesh firstBlocked = TestMeshes.grid(4, f -> f == 0 ? NON_WALK : STONE);
        assertEquals(OptionalInt.of(1), firstBlocked.findFaceAt(0.5f, 0.5f));
        assertEquals(OptionalInt.of(3), firstBlocked.findFaceAt(1f, 0.5f));
        assertEquals(OptionalInt.of(0), firstBlocked.findFaceAt(0.5f, 0.5f, false));
    }

    @Test
    void testBlockedFacesAreNotWalkableButHaveHeight() {
        WalkMesh mesh = blockedCentre();
        assertFalse(mesh.isPointWalkable(2f, 2f));
        assertTrue(mesh.projectToSurface(2.2f, 1.7f).isEmpty());
        assertEquals(0f, mesh.determineZ(2.2f, 1.7f).orElseThrow().floatValue());
        assertTrue(mesh.isPointWalkable(0.5f, 3.5f));

        int blocked = TestMeshes.cellFace(4, 1, 1, false);
        assertFalse(mesh.isWalkable(blocked));
        assertEquals(NON_WALK, mesh.getSurfaceMaterial(blocked));
        assertEquals(0, mesh.getAdjacentFaces(blocked).length);
    }

    @Test
    void testInvalidFaceIndices() {
        WalkMesh mesh = TestMeshes.flatGrid(2);
        assertFalse(mesh.isWalkable(-1));
        assertFalse(mesh.isWalkable(8));
        assertFalse(mesh.isWalkable(Integer.MAX_VALUE));
        assertEquals(-1, mesh.getSurfaceMaterial(8));
        assertTrue(mesh.getNeighbour(8, 0).isEmpty());
        assertTrue(mesh.getNeighbour(0, 3).isEmpty());
        assertTrue(mesh.getNeighbour(0, -1).isEmpty());
        assertEquals(WalkMesh.NO_NEIGHBOUR, mesh.getAdjacencyEntry(-2, 0));
        assertTrue(mesh.getFaceCenter(8).isEmpty());
        assertTrue(mesh.getHeightOnFace(8, 0f, 0f).isEmpty());
        assertEquals(0, mesh.getAdjacentFaces(-1).length);
    }

    @Test
    void testDerivedAdjacencyIsSymmetric() {
        WalkMesh mesh = TestMeshes.flatGrid(4);
        assertSymmetric(mesh);
        // Diagonal of cell (0, 0): edge 2 of face 0 meets edge 0 of face 1.
        assertEquals(3, mesh.getAdjacencyEntry(0, 2));
        assertEquals(OptionalInt.of(0), mesh.getNeighbour(1, 0));

        WalkMeshStats stats = mesh.getStats();
        assertEquals(25, stats.vertexCount);
        assertEquals(32, stats.faceCount);
        assertEquals(32, stats.walkableFaceCount);
        assertEquals(16, stats.boundaryEdgeCount);
        assertEquals(63, stats.treeNodeCount);
    }

    @Test
    void testNoLinksBetweenWalkableAndBlocked() {
        WalkMesh mesh = blockedCentre();
        assertSymmetric(mesh);
        for (int f = 0; f < mesh.getFaceCount(); f++) {
            for (int n : mesh.getAdjacentFaces(f)) {
                assertTrue(mesh.isWalkable(f) && mesh.isWalkable(n), f + " -> " + n);
            }
        }
    }

    @Test
    void testSuppliedAdjacency() {
        WalkMeshParams params = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        params.adjacency = new int[]{-1, -1, 3, 2, -1, -1};
        WalkMesh mesh = WalkMeshBuilder.build(params);
        assertEquals(OptionalInt.of(1), mesh.getNeighbour(0, 2));

        params.adjacency = new int[]{-1, -1, 3, -1, -1, -1};
        mesh = WalkMeshBuilder.build(params);
        assertTrue(mesh.getNeighbour(0, 2).isEmpty());
        assertSymmetric(mesh);

        params.adjacency = new int[]{-1, -1, 99, -1, -1, -1};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(params));
    }

    @Test
    void testBuilderRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(new WalkMeshParams()));

        WalkMeshParams badVertexCount = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        badVertexCount.vertices = new float[]{0, 0, 0, 1};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(badVertexCount));

        WalkMeshParams badFaces = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        badFaces.faces = new int[]{0, 1, 2, 3};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(badFaces));

        WalkMeshParams badMaterials = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        badMaterials.materials = new int[]{STONE};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(badMaterials));

        WalkMeshParams nanVertex = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        nanVertex.vertices[4] = Float.NaN;
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(nanVertex));

        WalkMeshParams badIndex = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        badIndex.faces[5] = 4;
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(badIndex));

        WalkMeshParams halfPlanes = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        halfPlanes.normals = new float[]{0, 0, 1, 0, 0, 1};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(halfPlanes));

        WalkMeshParams nanNormal = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        nanNormal.normals = new float[]{0, 0, 1, 0, Float.NaN, 1};
        nanNormal.planeDistances = new float[]{0, 0};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(nanNormal));

        WalkMeshParams infinitePlane = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        infinitePlane.normals = new float[]{0, 0, 1, 0, 0, 1};
        infinitePlane.planeDistances = new float[]{0, Float.POSITIVE_INFINITY};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(infinitePlane));

        WalkMeshParams badAdjacency = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        badAdjacency.adjacency = new int[]{-1, -1};
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(badAdjacency));

        WalkMeshParams noCategory = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        noCategory.category = null;
        assertThrows(IllegalArgumentException.class, () -> WalkMeshBuilder.build(noCategory));
    }

    @Test
    void testBuilderCopiesInput() {
        WalkMeshParams params = TestMeshes.gridParams(1, 0, 0, 0, 0, 0, f -> STONE);
        WalkMesh mesh = WalkMeshBuilder.build(params);
        params.materials[0] = NON_WALK;
        params.vertices[0] = 50f;
        assertTrue(mesh.isWalkable(0));
        assertEquals(0f, mesh.getVertices()[0]);
        mesh.getMaterials()[0] = NON_WALK;
        assertTrue(mesh.isWalkable(0));
    }

    @Test
    void testUnindexedCategoryAnswersTheSame() {
        WalkMeshParams params = TestMeshes.gridParams(3, 0, 0, 0, 0.1f, 0.2f, f -> f % 5 == 0 ? NON_WALK : STONE);
        WalkMesh indexed = WalkMeshBuilder.build(params);
        params.category = MeshCategory.PLACEABLE;
        WalkMesh placeable = WalkMeshBuilder.build(params);
        assertTrue(indexed.hasTree());
        assertFalse(placeable.hasTree());
        assertEquals(0, placeable.getStats().treeNodeCount);

        Random random = new Random(5);
        for (int i = 0; i < 300; i++) {
            float x = random.nextFloat() * 3.4f - 0.2f;
            float y = random.nextFloat() * 3.4f - 0.2f;
            assertEquals(indexed.findFaceAt(x, y), placeable.findFaceAt(x, y));
            assertEquals(indexed.determineZ(x, y), placeable.determineZ(x, y));
        }
    }

    @Test
    void testScanRaycastMatchesRaycast() {
        WalkMeshParams params = TestMeshes.gridParams(3, 0, 0, 0, 0.1f, 0.2f, f -> STONE);
        params.category = MeshCategory.DOOR;
        WalkMesh door = WalkMeshBuilder.build(params);
        Vector3f origin = new Vector3f(1.3f, 2.6f, 10f);
        Vector3f down = new Vector3f(0, 0, -1);
        RaycastHit viaRaycast = door.raycast(origin, down, 100f).orElseThrow();
        RaycastHit viaScan = door.scanRaycast(origin, down, 100f).orElseThrow();
        assertEquals(viaScan.face, viaRaycast.face);
        assertEquals(10f - (0.13f + 0.52f), viaRaycast.distance, 1e-4f);
        assertTrue(door.scanRaycast(origin, down, 1f).isEmpty());
    }

    @Test
    void testEmptyMesh() {
        WalkMeshParams params = new WalkMeshParams();
        params.vertices = new float[0];
        params.faces = new int[0];
        params.materials = new int[0];
        WalkMesh mesh = WalkMeshBuilder.build(params);
        assertEquals(0, mesh.getFaceCount());
        assertFalse(mesh.hasTree());
        assertTrue(mesh.findFaceAt(0f, 0f).isEmpty());
        assertTrue(mesh.raycast(new Vector3f(), new Vector3f(0, 0, -1), 10f).isEmpty());
    }

    @Test
    void testLineOfSight() {
        WalkMesh open = TestMeshes.flatGrid(4);
        Vector3f from = new Vector3f(0.2f, 0.6f, 0f);
        Vector3f to = new Vector3f(3.6f, 3.3f, 0f);
        assertTrue(open.hasLineOfSight(from, to));
        assertTrue(open.hasLineOfSight(to, from));
        assertTrue(open.hasLineOfSight(from, from));
        assertFalse(open.hasLineOfSight(from, new Vector3f(5f, 0.6f, 0f)));

        WalkMesh blocked = blockedCentre();
        assertFalse(blocked.hasLineOfSight(from, to));
        assertTrue(blocked.hasLineOfSight(from, new Vector3f(3.7f, 0.4f, 0f)));
    }

    @Test
    void testTranslate() {
        WalkMesh mesh = blockedCentre();
        WalkMesh moved = mesh.transform(new Matrix4f().translation(10f, -2f, 3f));
        Random random = new Random(9);
        for (int i = 0; i < 200; i++) {
            float x = random.nextFloat() * 4f;
            float y = random.nextFloat() * 4f;
            assertEquals(mesh.isPointWalkable(x, y), moved.isPointWalkable(x + 10f, y - 2f));
            assertEquals(mesh.determineZ(x, y).orElseThrow() + 3f,
                    moved.determineZ(x + 10f, y - 2f).orElseThrow().floatValue(), 1e-4f);
        }
        assertArrayEquals(mesh.getAdjacency(), moved.getAdjacency());
        assertArrayEquals(mesh.getMaterials(), moved.getMaterials());
    }

    @Test
    @DisplayName("A mirroring transform keeps faces upward and adjacency consistent")
    void testMirror() {
        WalkMesh mesh = WalkMeshBuilder.build(TestMeshes.gridParams(4, 0, 0, 0, 0.3f, 0.1f,
                f -> f % 7 == 0 ? NON_WALK : STONE));
        WalkMesh mirrored = mesh.transform(new Matrix4f().scaling(-1f, 1f, 1f));
        assertSymmetric(mirrored);

        float[] normals = mirrored.getNormals();
        for (int f = 0; f < mirrored.getFaceCount(); f++) {
            assertTrue(normals[f * 3 + 2] > 0, "face " + f + " points down");
        }

        WalkMeshParams rederived = new WalkMeshParams();
        rederived.vertices = mirrored.getVertices();
        rederived.faces = mirrored.getFaces();
        rederived.materials = mirrored.getMaterials();
        assertArrayEquals(WalkMeshBuilder.build(rederived).getAdjacency(), mirrored.getAdjacency());

        Random random = new Random(13);
        for (int i = 0; i < 200; i++) {
            float x = random.nextFloat() * 4f;
            float y = random.nextFloat() * 4f;
            assertEquals(mesh.isPointWalkable(x, y), mirrored.isPointWalkable(-x, y));
            assertEquals(mesh.determineZ(x, y).orElseThrow().floatValue(),
                    mirrored.determineZ(-x, y).orElseThrow().floatValue(), 1e-4f);
        }
    }

    @Test
    void testConcurrentQueries() throws Exception {
        WalkMesh mesh = blockedCentre();
        int samples = 500;
        float[] xs = new float[samples];
        float[] ys = new float[samples];
        OptionalInt[] expected = new OptionalInt[samples];
        Random random = new Random(17);
        for (int i = 0; i < samples; i++) {
            xs[i] = random.nextFloat() * 4f;
            ys[i] = random.nextFloat() * 4f;
            expected[i] = mesh.findFaceAt(xs[i], ys[i]);
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                tasks.add(() -> {
                    int mismatches = 0;
                    for (int round = 0; round < 20; round++) {
                        for (int i = 0; i < samples; i++) {
                            if (!expected[i].equals(mesh.findFaceAt(xs[i], ys[i]))) {
                                mismatches++;
                            }
                        }
                    }
                    return mismatches;
                });
            }
            for (Future<Integer> result : executor.invokeAll(tasks)) {
                assertEquals(0, result.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    private static void assertSymmetric(WalkMesh mesh) {
        for (int f = 0; f < mesh.getFaceCount(); f++) {
            for (int e = 0; e < 3; e++) {
                int v = mesh.getAdjacencyEntry(f, e);
                if (v != WalkMesh.NO_NEIGHBOUR) {
                    assertNotEquals(f, v / 3);
                    assertEquals(f * 3 + e, mesh.getAdjacencyEntry(v / 3, v % 3), "link " + f + "/" + e);
                }
            }
        }
    }
}
