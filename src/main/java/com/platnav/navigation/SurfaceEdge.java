package com.platnav.navigation;

/**
 * A walkable top edge: the horizontal extent of a surface and its height.
 *
 * @param left  smaller X of the surface
 * @param right larger X of the surface
 * @param y     surface height, the edge midpoint's Y
 */
public record SurfaceEdge(double left, double right, double y) {

    public double width() {
        return right - left;
    }

    public double centerX() {
        return (left + right) / 2.0;
    }

    /**
     * Check if the horizontal ranges strictly overlap (touching ends do not count).
     */
    public boolean overlapsHorizontally(SurfaceEdge other) {
        return left < other.right && right > other.left;
    }

    @Override
    public String toString() {
        return String.format("SurfaceEdge[%.2f..%.2f @ %.2f]", left, right, y);
    }
}
