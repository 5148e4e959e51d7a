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
package org.walkmesh4j.query;

/**
 * Search state of one face during a path query.
 */
public class Node {

    static final int OPEN = 0x01;
    static final int CLOSED = 0x02;

    /** Face this node stands for. */
    public final int face;
    /** Order in which the node was first discovered; breaks ties between equal totals. */
    public final int sequence;
    /** Node we came from, or null for the start. */
    public Node parent;
    /** Cost from the start face to this face. */
    public float cost;
    /** Cost plus heuristic estimate to the goal. */
    public float totalCost;
    /** Node flags, a combination of OPEN and CLOSED. */
    public int flags;

    public Node(int face, int sequence) {
        this.face = face;
        this.sequence = sequence;
    }

    @Override
    public String toString() {
        return "Node[face=" + face + ", cost=" + cost + ", total=" + totalCost + "]";
    }
}
