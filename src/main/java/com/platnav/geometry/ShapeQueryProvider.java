package com.platnav.geometry;

import java.util.List;
import java.util.Optional;

/**
 * Physics queries against the static 2D world.
 *
 * <p>This is the only engine-facing seam of the graph generator. Provide one adapter per
 * physics backend; {@link StaticShapeWorld} is the in-memory implementation.
 *
 * <p>Implementations are called from the thread running the generation and are not
 * required to be thread-safe.
 */
public interface ShapeQueryProvider {

    /**
     * Find the static shapes overlapping an axis-aligned box.
     *
     * @param center    box center
     * @param size      box full size
     * @param layerMask only shapes on these layers are returned
     * @return overlapping shapes, possibly empty, never null
     */
    List<StaticShape> overlapBox(Vec2 center, Vec2 size, int layerMask);

    /**
     * Cast a ray and return the closest hit.
     *
     * @param origin      ray start
     * @param direction   ray direction, need not be normalized
     * @param maxDistance maximum travel distance
     * @param layerMask   only shapes on these layers can be hit
     * @return the closest hit, or empty if nothing was hit within range
     */
    Optional<RaycastHit> raycast(Vec2 origin, Vec2 direction, double maxDistance, int layerMask);
}
