package com.platnav.geometry;

import lombok.Value;

/**
 * Result of a successful {@link ShapeQueryProvider#raycast} call.
 */
@Value
public class RaycastHit {

    /**
     * World-space point where the ray met the shape.
     */
    Vec2 point;

    /**
     * The shape that was hit.
     */
    StaticShape shape;

    /**
     * Distance travelled along the ray, 0 if the ray started inside the shape.
     */
    double distance;
}
