package com.platnav.geometry;

import lombok.Value;

/**
 * Axis-aligned rectangular area of the world, described by its center and full size.
 *
 * <p>Used both as the scan region of a graph generation and as shape bounds.
 */
@Value
public class Region {

    Vec2 center;
    Vec2 size;

    public static Region of(Vec2 center, Vec2 size) {
        return new Region(center, size);
    }

    /**
     * Build a region from its minimum and maximum corners.
     */
    public static Region fromMinMax(double minX, double minY, double maxX, double maxY) {
        return new Region(
                new Vec2((minX + maxX) / 2.0, (minY + maxY) / 2.0),
                new Vec2(maxX - minX, maxY - minY));
    }

    public double getMinX() {
        return center.getX() - size.getX() / 2.0;
    }

    public double getMaxX() {
        return center.getX() + size.getX() / 2.0;
    }

    public double getMinY() {
        return center.getY() - size.getY() / 2.0;
    }

    public double getMaxY() {
        return center.getY() + size.getY() / 2.0;
    }

    /**
     * Check whether two regions overlap. Touching edges count as overlap.
     */
    public boolean overlaps(Region other) {
        return getMinX() <= other.getMaxX() && getMaxX() >= other.getMinX()
                && getMinY() <= other.getMaxY() && getMaxY() >= other.getMinY();
    }

    public boolean contains(Vec2 point) {
        return point.getX() >= getMinX() && point.getX() <= getMaxX()
                && point.getY() >= getMinY() && point.getY() <= getMaxY();
    }

    @Override
    public String toString() {
        return String.format("Region[center=%s, size=%s]", center, size);
    }
}
