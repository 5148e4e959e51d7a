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
 * Node of an {@link AABBTree}. Nodes are immutable and refer to each other by arena index only.
 */
public final class AABBNode {

    public static final int NONE = -1;

    public final float minX, minY, minZ;
    public final float maxX, maxY, maxZ;
    /** Arena index of the left child, or {@link #NONE} for a leaf. */
    public final int left;
    /** Arena index of the right child, or {@link #NONE} for a leaf. */
    public final int right;
    /** Face held by a leaf, or {@link #NONE} for an internal node. */
    public final int face;

    private AABBNode(float minX, float minY, float minZ, float maxX, float maxY, float maxZ,
                     int left, int right, int face) {
        this.minX = minX;
        this.minY = minY;
        this.minZ = minZ;
        this.maxX = maxX;
        this.maxY = maxY;
        this.maxZ = maxZ;
        this.left = left;
        this.right = right;
        this.face = face;
    }

    static AABBNode leaf(float[] bounds, int face) {
        return new AABBNode(bounds[0], bounds[1], bounds[2], bounds[3], bounds[4], bounds[5], NONE, NONE, face);
    }

    static AABBNode internal(AABBNode l, int left, AABBNode r, int right) {
        return new AABBNode(
                Math.min(l.minX, r.minX), Math.min(l.minY, r.minY), Math.min(l.minZ, r.minZ),
                Math.max(l.maxX, r.maxX), Math.max(l.maxY, r.maxY), Math.max(l.maxZ, r.maxZ),
                left, right, NONE);
    }

    public boolean isLeaf() {
        return face != NONE;
    }

    @Override
    public String toString() {
        return (isLeaf() ? "Leaf[face=" + face : "Node[left=" + left + ", right=" + right)
                + ", min=(" + minX + ", " + minY + ", " + minZ + "), max=(" + maxX + ", " + maxY + ", " + maxZ + ")]";
    }
}
