package com.platnav.navigation;

import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.Vec2;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Places navigation nodes along a walkable edge.
 *
 * <p>Narrow surfaces get a single center node. Wider ones get a left and a right edge
 * node, inset from the ends, and interior surface nodes spread evenly between them:
 * the interior count is {@code floor(innerWidth / spacing)} and the actual spacing is
 * recomputed as {@code innerWidth / (count + 1)} so no partial gap is left at one end.
 */
public class NodePlacer {

    private final PlatformGraphConfig config;

    public NodePlacer(PlatformGraphConfig config) {
        this.config = config;
    }

    /**
     * Create the nodes for one edge.
     *
     * @param edge    the walkable edge
     * @param shapeId ID of the shape the edge belongs to
     * @param oneWay  whether that shape is a one-way platform
     * @param nextId  supplies node IDs, called once per node in emission order
     * @return nodes in emission order: left edge, right edge, then interior left to right
     */
    public List<PlatformNode> placeNodes(SurfaceEdge edge, int shapeId, boolean oneWay, IntSupplier nextId) {
        List<PlatformNode> nodes = new ArrayList<>();
        double width = edge.width();
        double y = edge.y();

        if (width < config.getMinPlatformWidth()) {
            nodes.add(PlatformNode.surface(nextId.getAsInt(), new Vec2(edge.centerX(), y), shapeId, oneWay));
            return nodes;
        }

        double inset = config.getEdgeInset();
        nodes.add(PlatformNode.edge(nextId.getAsInt(), new Vec2(edge.left() + inset, y), shapeId, true, oneWay));
        nodes.add(PlatformNode.edge(nextId.getAsInt(), new Vec2(edge.right() - inset, y), shapeId, false, oneWay));

        double innerWidth = width - 2 * inset;
        int innerCount = (int) Math.floor(innerWidth / config.actualNodeSpacing());
        if (innerCount > 0) {
            double spacing = innerWidth / (innerCount + 1);
            for (int i = 1; i <= innerCount; i++) {
                double x = edge.left() + inset + spacing * i;
                nodes.add(PlatformNode.surface(nextId.getAsInt(), new Vec2(x, y), shapeId, oneWay));
            }
        }
        return nodes;
    }
}
