package com.platnav.geometry;

/**
 * Geometric classes of static collision shapes understood by the graph generator.
 */
public enum ShapeKind {
    /**
     * Axis-aligned box. Enumerates a single path made of its four corners.
     */
    BOX,

    /**
     * Open sequence of points. Not closed, so it has no interior.
     */
    POLYLINE,

    /**
     * Closed polygon, possibly made of several disjoint loops sharing one identity.
     */
    POLYGON
}
