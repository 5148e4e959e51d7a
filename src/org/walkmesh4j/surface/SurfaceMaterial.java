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
package org.walkmesh4j.surface;

import org.jetbrains.annotations.Nullable;

/**
 * Surface materials a walkmesh face can carry.
 * <p>
 * This table is the only definition of walkability. Anything that needs to know whether a material id can be
 * walked on asks {@link #isWalkable(int)}.
 */
public enum SurfaceMaterial {

    UNDEFINED(0, Traversal.BLOCKED),
    DIRT(1, Traversal.NORMAL),
    OBSCURING(2, Traversal.BLOCKED),
    GRASS(3, Traversal.NORMAL),
    STONE(4, Traversal.NORMAL),
    WOOD(5, Traversal.NORMAL),
    WATER(6, Traversal.NORMAL),
    NON_WALK(7, Traversal.BLOCKED),
    TRANSPARENT(8, Traversal.BLOCKED),
    CARPET(9, Traversal.NORMAL),
    METAL(10, Traversal.NORMAL),
    PUDDLES(11, Traversal.HAZARDOUS),
    SWAMP(12, Traversal.HAZARDOUS),
    MUD(13, Traversal.HAZARDOUS),
    LEAVES(14, Traversal.NORMAL),
    LAVA(15, Traversal.AVOID),
    BOTTOMLESS_PIT(16, Traversal.AVOID),
    DEEP_WATER(17, Traversal.BLOCKED),
    DOOR(18, Traversal.NORMAL),
    NON_WALK_GRASS(19, Traversal.BLOCKED),
    TRIGGER(30, Traversal.NORMAL);

    /**
     * How a walker treats a material.
     */
    public enum Traversal {
        /** Ordinary ground. */
        NORMAL,
        /** Walkable but slow or unpleasant. */
        HAZARDOUS,
        /** Walkable, but a path should go around it whenever it can. */
        AVOID,
        /** Not walkable. */
        BLOCKED
    }

    /** Highest material id the format can encode. */
    public static final int MAX_ID = 30;

    private static final SurfaceMaterial[] BY_ID = new SurfaceMaterial[MAX_ID + 1];

    static {
        for (SurfaceMaterial m : values()) {
            BY_ID[m.id] = m;
        }
    }

    public final int id;
    public final Traversal traversal;

    SurfaceMaterial(int id, Traversal traversal) {
        this.id = id;
        this.traversal = traversal;
    }

    public boolean walkable() {
        return traversal != Traversal.BLOCKED;
    }

    /**
     * @return the material for an id, or null when the id is outside the table
     */
    @Nullable
    public static SurfaceMaterial fromId(int id) {
        return id >= 0 && id <= MAX_ID ? BY_ID[id] : null;
    }

    /**
     * Unknown ids are not walkable.
     */
    public static boolean isWalkable(int id) {
        SurfaceMaterial m = fromId(id);
        return m != null && m.walkable();
    }

    public static Traversal traversalOf(int id) {
        SurfaceMaterial m = fromId(id);
        return m == null ? Traversal.BLOCKED : m.traversal;
    }
}
