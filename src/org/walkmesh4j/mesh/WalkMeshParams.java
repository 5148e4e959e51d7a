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

/**
 * Raw arrays describing one walkmesh, as handed over by a file reader or produced by a transform.
 * Passed to {@link WalkMeshBuilder#build(WalkMeshParams)}; the builder copies everything it keeps.
 */
public class WalkMeshParams {

    public static final float DEFAULT_WELD_TOLERANCE = 1e-3f;

    /**
     * Vertex positions. [(x, y, z) * vertexCount]
     */
    public float[] vertices;
    /**
     * Vertex indices, counter-clockwise seen from +z. [(a, b, c) * faceCount]
     */
    public int[] faces;
    /**
     * Surface material id of each face. [Size: faceCount]
     */
    public int[] materials;
    /**
     * Unit face normals. Optional, derived from the vertices when null. [(x, y, z) * faceCount]
     */
    public float[] normals;
    /**
     * Plane offsets matching {@link #normals}. Optional, derived when null. [Size: faceCount]
     */
    public float[] planeDistances;
    /**
     * Packed adjacency, {@code neighbour * 3 + neighbourEdge} or {@link WalkMesh#NO_NEIGHBOUR}. Optional; when
     * null it is derived by welding coincident edges of walkable faces. [Size: faceCount * 3]
     */
    public int[] adjacency;
    /**
     * Decides whether the mesh gets an AABB tree.
     */
    public MeshCategory category = MeshCategory.AREA;
    /**
     * Distance under which two edge endpoints are considered the same point when deriving adjacency.
     */
    public float weldTolerance = DEFAULT_WELD_TOLERANCE;
}
