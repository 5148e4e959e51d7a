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

import java.util.Arrays;

/**
 * Per-material traversal cost multipliers used by path search.
 * <p>
 * Multipliers are tunable; only their ordering matters (normal &lt; hazardous &lt; avoid). Every multiplier is at
 * least 1, which keeps the straight-line heuristic admissible. Non-walkable materials never get a cost because
 * the search never enters them.
 */
public class MaterialCostTable {

    public static final float DEFAULT_NORMAL_COST = 1f;
    public static final float DEFAULT_HAZARDOUS_COST = 2f;
    public static final float DEFAULT_AVOID_COST = 50f;

    private static final MaterialCostTable DEFAULT = new MaterialCostTable(DEFAULT_NORMAL_COST,
            DEFAULT_HAZARDOUS_COST, DEFAULT_AVOID_COST);

    private final float[] costs = new float[SurfaceMaterial.MAX_ID + 1];

    public MaterialCostTable(float normalCost, float hazardousCost, float avoidCost) {
        checkMultiplier("normalCost", normalCost);
        checkMultiplier("hazardousCost", hazardousCost);
        checkMultiplier("avoidCost", avoidCost);
        Arrays.fill(costs, Float.POSITIVE_INFINITY);
        for (SurfaceMaterial m : SurfaceMaterial.values()) {
            switch (m.traversal) {
                case NORMAL:
                    costs[m.id] = normalCost;
                    break;
                case HAZARDOUS:
                    costs[m.id] = hazardousCost;
                    break;
                case AVOID:
                    costs[m.id] = avoidCost;
                    break;
                default:
                    break;
            }
        }
    }

    private MaterialCostTable(float[] costs) {
        System.arraycopy(costs, 0, this.costs, 0, this.costs.length);
    }

    public static MaterialCostTable defaults() {
        return DEFAULT;
    }

    /**
     * Returns a copy of this table with one material's multiplier replaced.
     *
     * @throws IllegalArgumentException if the material is not walkable or the multiplier is below 1
     */
    public MaterialCostTable with(SurfaceMaterial material, float cost) {
        if (!material.walkable()) {
            throw new IllegalArgumentException("Cannot assign a traversal cost to non-walkable material " + material);
        }
        checkMultiplier(material.name(), cost);
        MaterialCostTable copy = new MaterialCostTable(costs);
        copy.costs[material.id] = cost;
        return copy;
    }

    /**
     * @return the multiplier for a material id, or positive infinity for anything not walkable
     */
    public float getCost(int materialId) {
        if (!SurfaceMaterial.isWalkable(materialId)) {
            return Float.POSITIVE_INFINITY;
        }
        return costs[materialId];
    }

    private static void checkMultiplier(String name, float cost) {
        if (!(cost >= 1f) || Float.isInfinite(cost)) {
            throw new IllegalArgumentException(name + " must be a finite multiplier >= 1, got " + cost);
        }
    }
}
