package com.platnav.geometry;

import lombok.Value;

/**
 * Immutable 2D world-space coordinate.
 */
@Value
public class Vec2 {

    public static final Vec2 ZERO = new Vec2(0, 0);

    /**
     * Unit vector pointing down (negative Y).
     */
    public static final Vec2 DOWN = new Vec2(0, -1);

    double x;
    double y;

    public static Vec2 of(double x, double y) {
        return new Vec2(x, y);
    }

    public Vec2 add(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 subtract(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    public Vec2 scale(double factor) {
        return new Vec2(x * factor, y * factor);
    }

    public double length() {
        return Math.sqrt(x * x + y * y);
    }

    /**
     * Unit vector in the same direction, or {@link #ZERO} for a zero-length vector.
     */
    public Vec2 normalized() {
        double len = length();
        if (len == 0) {
            return ZERO;
        }
        return new Vec2(x / len, y / len);
    }

    public double distanceSquaredTo(Vec2 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }

    public double distanceTo(Vec2 other) {
        return Math.sqrt(distanceSquaredTo(other));
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
