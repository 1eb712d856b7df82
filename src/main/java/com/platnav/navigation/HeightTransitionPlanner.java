package com.platnav.navigation;

import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.Vec2;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Adds edge nodes where two surfaces at different heights overlap horizontally.
 *
 * <p>When the end of a higher platform hangs over a lower one, a character standing on the
 * lower surface needs a node right below that end to jump up from, and a character on the
 * higher surface needs a node above the lower platform's end to land on. Regular placement
 * only puts edge nodes at each surface's own ends, so these points are added here, across
 * all shapes of the region.
 */
@Slf4j
public class HeightTransitionPlanner {

    private final PlatformGraphConfig config;

    public HeightTransitionPlanner(PlatformGraphConfig config) {
        this.config = config;
    }

    /**
     * An accepted edge together with the shape it came from.
     */
    public record ShapeEdge(SurfaceEdge edge, int shapeId, boolean oneWay) {
    }

    /**
     * Create transition nodes for every pair of edges whose height difference lies within
     * [{@code minTransitionHeight}, {@code maxTransitionHeight}].
     *
     * @param edges         all accepted edges of the region
     * @param existingNodes nodes placed so far, used to skip positions that are already covered
     * @param nextId        supplies node IDs
     * @return the new nodes; existing nodes are not modified
     */
    public List<PlatformNode> planTransitionNodes(List<ShapeEdge> edges, List<PlatformNode> existingNodes,
                                                  IntSupplier nextId) {
        List<PlatformNode> added = new ArrayList<>();
        if (edges.size() < 2) {
            return added;
        }

        List<ShapeEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingDouble(e -> e.edge().y()));

        double inset = config.getEdgeInset();

        for (int i = 0; i < sorted.size(); i++) {
            ShapeEdge lower = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                ShapeEdge upper = sorted.get(j);

                double heightDiff = upper.edge().y() - lower.edge().y();
                if (heightDiff < config.getMinTransitionHeight() || heightDiff > config.getMaxTransitionHeight()) {
                    continue;
                }

                // Take-off points below the upper surface's ends
                if (isInside(upper.edge().left(), lower.edge(), inset)) {
                    tryAdd(upper.edge().left(), lower, true, existingNodes, added, nextId);
                }
                if (isInside(upper.edge().right(), lower.edge(), inset)) {
                    tryAdd(upper.edge().right(), lower, false, existingNodes, added, nextId);
                }

                // Landing points above the lower surface's ends
                if (isInside(lower.edge().left(), upper.edge(), inset)) {
                    tryAdd(lower.edge().left(), upper, true, existingNodes, added, nextId);
                }
                if (isInside(lower.edge().right(), upper.edge(), inset)) {
                    tryAdd(lower.edge().right(), upper, false, existingNodes, added, nextId);
                }
            }
        }

        if (!added.isEmpty()) {
            log.debug("Added {} height transition nodes over {} edges", added.size(), edges.size());
        }
        return added;
    }

    private static boolean isInside(double x, SurfaceEdge edge, double inset) {
        return x > edge.left() + inset && x < edge.right() - inset;
    }

    private void tryAdd(double x, ShapeEdge target, boolean leftEdge, List<PlatformNode> existingNodes,
                        List<PlatformNode> added, IntSupplier nextId) {
        Vec2 position = new Vec2(x, target.edge().y());
        double radius = config.getTransitionNodeMergeRadius();
        if (hasNodeNear(existingNodes, position, radius) || hasNodeNear(added, position, radius)) {
            return;
        }
        added.add(PlatformNode.edge(nextId.getAsInt(), position, target.shapeId(), leftEdge, target.oneWay()));
    }

    private static boolean hasNodeNear(List<PlatformNode> nodes, Vec2 position, double radius) {
        double radiusSq = radius * radius;
        for (PlatformNode node : nodes) {
            if (position.distanceSquaredTo(node.getPosition()) < radiusSq) {
                return true;
            }
        }
        return false;
    }
}
