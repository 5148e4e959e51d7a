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
package org.walkmesh4j.stitch;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walkmesh4j.mesh.EdgeMatcher;
import org.walkmesh4j.mesh.WalkMesh;
import org.walkmesh4j.mesh.WalkMeshBuilder;
import org.walkmesh4j.mesh.WalkMeshParams;

import java.util.List;

/**
 * Merges several walkmeshes (typically the rooms of one area) into a single mesh and links faces across their
 * shared boundaries.
 * <p>
 * Faces and vertices keep their order: faces of the first mesh come first, then the faces of the second, and so on.
 * Links inside each source mesh are carried over. New links are only made between faces of different source meshes,
 * only across edges that were open in both, and only when both faces are walkable. Source meshes are never
 * modified.
 */
public class WalkMeshStitcher {

    private static final Logger log = LoggerFactory.getLogger(WalkMeshStitcher.class);

    private final StitchConfig config;

    public WalkMeshStitcher() {
        this(StitchConfig.defaults());
    }

    public WalkMeshStitcher(@NotNull StitchConfig config) {
        this.config = config;
    }

    /**
     * @return the merged mesh; an empty list gives an empty mesh
     */
    @NotNull
    public WalkMesh stitch(@NotNull List<WalkMesh> meshes) {
        int vertexCount = 0;
        int faceCount = 0;
        for (WalkMesh mesh : meshes) {
            vertexCount += mesh.getVertexCount();
            faceCount += mesh.getFaceCount();
        }

        float[] vertices = new float[vertexCount * 3];
        int[] faces = new int[faceCount * 3];
        int[] materials = new int[faceCount];
        float[] normals = new float[faceCount * 3];
        float[] planeDistances = new float[faceCount];
        int[] adjacency = new int[faceCount * 3];
        int[] groups = new int[faceCount];

        int vertexOffset = 0;
        int faceOffset = 0;
        for (int m = 0; m < meshes.size(); m++) {
            WalkMesh mesh = meshes.get(m);
            int nv = mesh.getVertexCount();
            int nf = mesh.getFaceCount();
            System.arraycopy(mesh.getVertices(), 0, vertices, vertexOffset * 3, nv * 3);
            System.arraycopy(mesh.getMaterials(), 0, materials, faceOffset, nf);
            System.arraycopy(mesh.getNormals(), 0, normals, faceOffset * 3, nf * 3);
            System.arraycopy(mesh.getPlaneDistances(), 0, planeDistances, faceOffset, nf);
            int[] srcFaces = mesh.getFaces();
            int[] srcAdjacency = mesh.getAdjacency();
            for (int i = 0; i < nf * 3; i++) {
                faces[faceOffset * 3 + i] = srcFaces[i] + vertexOffset;
                int v = srcAdjacency[i];
                adjacency[faceOffset * 3 + i] = v == WalkMesh.NO_NEIGHBOUR ? WalkMesh.NO_NEIGHBOUR : v + faceOffset * 3;
            }
            for (int f = 0; f < nf; f++) {
                groups[faceOffset + f] = m;
            }
            vertexOffset += nv;
            faceOffset += nf;
        }

        int links = new EdgeMatcher(vertices, faces, materials, config.tolerance).weld(adjacency, groups);
        log.debug("Stitched {} meshes ({} faces) with {} new links", meshes.size(), faceCount, links);

        WalkMeshParams params = new WalkMeshParams();
        params.vertices = vertices;
        params.faces = faces;
        params.materials = materials;
        params.normals = normals;
        params.planeDistances = planeDistances;
        params.adjacency = adjacency;
        params.category = config.category;
        params.weldTolerance = config.tolerance;
        return WalkMeshBuilder.build(params);
    }
}
