package com.platnav.navigation;

import com.platnav.geometry.Vec2;
import lombok.Builder;
import lombok.Value;

/**
 * A navigation node standing on a walkable surface.
 *
 * <p>Immutable, so query results can be handed to callers as is.
 */
@Value
@Builder(toBuilder = true)
public class PlatformNode {

    /**
     * Unique within one generated graph. Assigned in generation order starting at 0.
     */
    int id;

    /**
     * World position. Y is the walkable surface height, not the shape's center.
     */
    Vec2 position;

    PlatformNodeType type;

    /**
     * ID of the static shape the node was generated from. Only used to group nodes of
     * the same surface; the graph never holds the shape itself.
     */
    int shapeId;

    /**
     * Whether the source shape is a one-way platform.
     */
    boolean oneWay;

    /**
     * Height of the surface the node stands on.
     */
    double surfaceY;

    /**
     * Create a surface node.
     */
    public static PlatformNode surface(int id, Vec2 position, int shapeId, boolean oneWay) {
        return new PlatformNode(id, position, PlatformNodeType.SURFACE, shapeId, oneWay, position.getY());
    }

    /**
     * Create an edge node.
     *
     * @param leftEdge true for a {@link PlatformNodeType#LEFT_EDGE}, false for a right one
     */
    public static PlatformNode edge(int id, Vec2 position, int shapeId, boolean leftEdge, boolean oneWay) {
        PlatformNodeType type = leftEdge ? PlatformNodeType.LEFT_EDGE : PlatformNodeType.RIGHT_EDGE;
        return new PlatformNode(id, position, type, shapeId, oneWay, position.getY());
    }

    public boolean isEdge() {
        return type == PlatformNodeType.LEFT_EDGE || type == PlatformNodeType.RIGHT_EDGE;
    }

    public double distanceTo(Vec2 point) {
        return position.distanceTo(point);
    }

    public double distanceTo(PlatformNode other) {
        return position.distanceTo(other.position);
    }

    @Override
    public String toString() {
        return String.format("PlatformNode[%d, %s at %s, shape %d%s]",
                id, type, position, shapeId, oneWay ? ", one-way" : "");
    }
}
