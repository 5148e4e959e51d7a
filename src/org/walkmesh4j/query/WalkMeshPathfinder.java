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

import org.jetbrains.annotations.NotNull;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walkmesh4j.IntArrayList;
import org.walkmesh4j.mesh.WalkMesh;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.PriorityQueue;

import static org.walkmesh4j.Vectors.isFinite;

/**
 * A* search over the walkable faces of a {@link WalkMesh}.
 * <p>
 * Nodes are faces, edges are adjacency links between walkable faces. Moving into a face costs the distance
 * between the two face centres times the entered face's material multiplier; the heuristic is the straight-line
 * distance from a face centre to the goal face centre, which never overestimates because every multiplier is at
 * least 1.
 * <p>
 * Each query allocates its own open list and node pool, so one pathfinder can serve concurrent callers.
 */
public class WalkMeshPathfinder {

    private static final Logger log = LoggerFactory.getLogger(WalkMeshPathfinder.class);

    private static final float COLINEAR_EPS = 1e-4f;

    private final WalkMesh mesh;
    private final PathfinderConfig config;

    public WalkMeshPathfinder(@NotNull WalkMesh mesh) {
        this(mesh, PathfinderConfig.defaults());
    }

    public WalkMeshPathfinder(@NotNull WalkMesh mesh, @NotNull PathfinderConfig config) {
        this.mesh = mesh;
        this.config = config;
    }

    public WalkMesh getMesh() {
        return mesh;
    }

    /**
     * Finds a walkable path between two points.
     *
     * @return waypoints from {@code start} to {@code goal}, or empty if either point is off the walkable surface or
     * the goal cannot be reached. A partial path is never returned.
     */
    public Optional<List<Vector3f>> findPath(Vector3f start, Vector3f goal) {
        Optional<int[]> corridor = findFacePath(start, goal);
        if (corridor.isEmpty()) {
            return Optional.empty();
        }
        int[] faces = corridor.get();
        List<Vector3f> waypoints = new ArrayList<>(faces.length + 1);
        waypoints.add(new Vector3f(start));
        Vector3f mid = new Vector3f();
        for (int i = 0; i + 1 < faces.length; i++) {
            int edge = sharedEdge(faces[i], faces[i + 1]);
            waypoints.add(new Vector3f(mesh.getEdgeMidpointUnsafe(faces[i], edge, mid)));
        }
        waypoints.add(new Vector3f(goal));
        if (config.smoothPath && waypoints.size() > 2) {
            waypoints = removeColinear(smooth(waypoints));
        }
        return Optional.of(waypoints);
    }

    /**
     * Finds the sequence of faces a walker passes through from {@code start} to {@code goal}.
     *
     * @return face indices from the start face to the goal face, or empty if there is no path
     */
    public Optional<int[]> findFacePath(Vector3f start, Vector3f goal) {
        // Validate input
        if (!isFinite(start) || !isFinite(goal)) {
            return Optional.empty();
        }
        OptionalInt startFace = mesh.findFaceAt(start.x, start.y, true);
        OptionalInt goalFace = mesh.findFaceAt(goal.x, goal.y, true);
        if (startFace.isEmpty() || goalFace.isEmpty()) {
            return Optional.empty();
        }
        int startRef = startFace.getAsInt();
        int endRef = goalFace.getAsInt();
        if (startRef == endRef) {
            return Optional.of(new int[]{startRef});
        }

        NodePool nodePool = new NodePool();
        PriorityQueue<Node> openList = new PriorityQueue<>(
                Comparator.<Node>comparingDouble(n -> n.totalCost).thenComparingInt(n -> n.sequence));

        Vector3f goalCenter = mesh.getFaceCenterUnsafe(endRef, new Vector3f());
        Vector3f bestCenter = new Vector3f();
        Vector3f neighbourCenter = new Vector3f();

        Node startNode = nodePool.getNode(startRef);
        startNode.cost = 0;
        startNode.totalCost = mesh.getFaceCenterUnsafe(startRef, bestCenter).distance(goalCenter);
        startNode.flags = Node.OPEN;
        openList.offer(startNode);

        int iterations = 0;
        while (!openList.isEmpty()) {
            if (config.maxIterations > 0 && ++iterations > config.maxIterations) {
                log.debug("Path search from face {} to {} gave up after {} iterations", startRef, endRef,
                        config.maxIterations);
                return Optional.empty();
            }

            // Remove node from open list and put it in closed list.
            Node bestNode = openList.poll();
            bestNode.flags &= ~Node.OPEN;
            bestNode.flags |= Node.CLOSED;

            // Reached the goal, stop searching.
            if (bestNode.face == endRef) {
                return Optional.of(getPathToNode(bestNode));
            }

            int bestRef = bestNode.face;
            int parentRef = bestNode.parent == null ? WalkMesh.NO_NEIGHBOUR : bestNode.parent.face;
            mesh.getFaceCenterUnsafe(bestRef, bestCenter);

            for (int edge = 0; edge < 3; edge++) {
                int neighbourRef = mesh.getNeighbourUnsafe(bestRef, edge);

                // Skip boundaries and do not expand back to where we came from.
                if (neighbourRef == WalkMesh.NO_NEIGHBOUR || neighbourRef == parentRef || !mesh.isWalkable(neighbourRef)) {
                    continue;
                }

                float multiplier = config.costTable.getCost(mesh.getSurfaceMaterial(neighbourRef));
                if (Float.isInfinite(multiplier)) {
                    continue;
                }
                mesh.getFaceCenterUnsafe(neighbourRef, neighbourCenter);
                float cost = bestNode.cost + bestCenter.distance(neighbourCenter) * multiplier;
                float total = cost + neighbourCenter.distance(goalCenter);

                Node neighbourNode = nodePool.getNode(neighbourRef);
                // The node is already in open list, and the new result is worse, skip.
                if ((neighbourNode.flags & Node.OPEN) != 0 && total >= neighbourNode.totalCost) {
                    continue;
                }
                // The node is already visited and processed, and the new result is worse, skip.
                if ((neighbourNode.flags & Node.CLOSED) != 0 && total >= neighbourNode.totalCost) {
                    continue;
                }

                if ((neighbourNode.flags & Node.OPEN) != 0) {
                    // Already in open, take it out before its key changes.
                    openList.remove(neighbourNode);
                }
                neighbourNode.parent = bestNode;
                neighbourNode.cost = cost;
                neighbourNode.totalCost = total;
                neighbourNode.flags = Node.OPEN;
                openList.offer(neighbourNode);
            }
        }

        log.debug("No path from face {} to {}: explored {} faces", startRef, endRef, nodePool.size());
        return Optional.empty();
    }

    private static int[] getPathToNode(Node endNode) {
        IntArrayList path = new IntArrayList();
        for (Node n = endNode; n != null; n = n.parent) {
            path.add(n.face);
        }
        path.reverse();
        return path.toArray();
    }

    private int sharedEdge(int face, int neighbour) {
        for (int e = 0; e < 3; e++) {
            if (mesh.getNeighbourUnsafe(face, e) == neighbour) {
                return e;
            }
        }
        throw new IllegalStateException("Faces " + face + " and " + neighbour + " are not adjacent");
    }

    /**
     * From each kept waypoint, jumps to the furthest later waypoint still in line of sight.
     */
    private List<Vector3f> smooth(List<Vector3f> points) {
        List<Vector3f> result = new ArrayList<>();
        result.add(points.get(0));
        int last = points.size() - 1;
        int anchor = 0;
        while (anchor < last) {
            int next = anchor + 1;
            for (int j = last; j > anchor + 1; j--) {
                if (mesh.hasLineOfSight(points.get(anchor), points.get(j))) {
                    next = j;
                    break;
                }
            }
            result.add(points.get(next));
            anchor = next;
        }
        return result;
    }

    /**
     * Drops interior waypoints that lie on the straight line between their neighbours, as long as the shortcut
     * stays walkable.
     */
    private List<Vector3f> removeColinear(List<Vector3f> points) {
        List<Vector3f> result = new ArrayList<>(points.size());
        result.add(points.get(0));
        for (int i = 1; i + 1 < points.size(); i++) {
            Vector3f a = result.get(result.size() - 1);
            Vector3f p = points.get(i);
            Vector3f b = points.get(i + 1);
            float abx = b.x - a.x;
            float aby = b.y - a.y;
            float len = (float) Math.sqrt(abx * abx + aby * aby);
            float cross = abx * (p.y - a.y) - aby * (p.x - a.x);
            float along = abx * (p.x - a.x) + aby * (p.y - a.y);
            boolean between = along >= 0 && along <= len * len;
            boolean colinear = len > 0 && Math.abs(cross) <= COLINEAR_EPS * len && between;
            if (!colinear || !mesh.hasLineOfSight(a, b)) {
                result.add(p);
            }
        }
        result.add(points.get(points.size() - 1));
        return result;
    }
}
