package com.platnav.geometry;

import java.util.List;

/**
 * A static collision shape as seen by the graph generator.
 *
 * <p>Implementations are adapters over an engine's physics shapes. The generator only
 * reads them: it never stores a shape inside the graph, only its {@link #getId() id}.
 */
public interface StaticShape {

    /**
     * Identity handle of this shape. Must be unique within one {@link ShapeQueryProvider}.
     */
    int getId();

    ShapeKind getKind();

    /**
     * Physics layer index (0-31) the shape lives on.
     */
    int getLayer();

    /**
     * World-space point paths of this shape.
     *
     * <p>Boxes return their four corners as one path, polygons one list per loop,
     * polylines their single open point sequence.
     *
     * @return immutable list of paths, never null
     */
    List<List<Vec2>> getPaths();

    /**
     * World-space axis-aligned bounds.
     */
    Region getBounds();

    /**
     * Check if this shape lies on any layer of the mask.
     *
     * @param layerMask bitmask of layers
     * @return true if the shape's layer bit is set in the mask
     */
    default boolean isOnLayer(int layerMask) {
        return ((1 << getLayer()) & layerMask) != 0;
    }
}
