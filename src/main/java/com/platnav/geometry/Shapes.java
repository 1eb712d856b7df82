package com.platnav.geometry;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Geometry helpers shared by the shape implementations and {@link StaticShapeWorld}.
 */
@UtilityClass
public class Shapes {

    private static final double EPSILON = 1e-9;

    /**
     * Axis-aligned bounds of a set of paths. Empty input yields a zero-size region at the origin.
     */
    public static Region boundsOf(List<List<Vec2>> paths) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        boolean any = false;

        for (List<Vec2> path : paths) {
            for (Vec2 p : path) {
                minX = Math.min(minX, p.getX());
                minY = Math.min(minY, p.getY());
                maxX = Math.max(maxX, p.getX());
                maxY = Math.max(maxY, p.getY());
                any = true;
            }
        }

        if (!any) {
            return new Region(Vec2.ZERO, Vec2.ZERO);
        }
        return Region.fromMinMax(minX, minY, maxX, maxY);
    }

    /**
     * Even-odd containment test over all loops of a closed shape. Points on an edge count as inside.
     */
    public static boolean containsPoint(List<List<Vec2>> loops, Vec2 point) {
        boolean inside = false;
        for (List<Vec2> loop : loops) {
            int n = loop.size();
            if (n < 3) {
                continue;
            }
            for (int i = 0, j = n - 1; i < n; j = i++) {
                Vec2 a = loop.get(i);
                Vec2 b = loop.get(j);
                if (isOnSegment(point, a, b)) {
                    return true;
                }
                boolean crosses = (a.getY() > point.getY()) != (b.getY() > point.getY());
                if (crosses) {
                    double xCross = (b.getX() - a.getX()) * (point.getY() - a.getY())
                            / (b.getY() - a.getY()) + a.getX();
                    if (point.getX() < xCross) {
                        inside = !inside;
                    }
                }
            }
        }
        return inside;
    }

    /**
     * Intersect a ray with a segment.
     *
     * @param origin    ray origin
     * @param direction unit ray direction
     * @param a         segment start
     * @param b         segment end
     * @return distance along the ray to the intersection, or -1 if they do not meet
     */
    public static double raySegmentDistance(Vec2 origin, Vec2 direction, Vec2 a, Vec2 b) {
        Vec2 edge = b.subtract(a);
        double denom = cross(direction, edge);
        if (Math.abs(denom) < EPSILON) {
            return -1;
        }
        Vec2 toStart = a.subtract(origin);
        double t = cross(toStart, edge) / denom;
        double u = cross(toStart, direction) / denom;
        if (t < 0 || u < -EPSILON || u > 1 + EPSILON) {
            return -1;
        }
        return t;
    }

    private static boolean isOnSegment(Vec2 p, Vec2 a, Vec2 b) {
        Vec2 ab = b.subtract(a);
        Vec2 ap = p.subtract(a);
        if (Math.abs(cross(ab, ap)) > EPSILON) {
            return false;
        }
        double dot = ap.getX() * ab.getX() + ap.getY() * ab.getY();
        return dot >= -EPSILON && dot <= ab.getX() * ab.getX() + ab.getY() * ab.getY() + EPSILON;
    }

    private static double cross(Vec2 a, Vec2 b) {
        return a.getX() * b.getY() - a.getY() * b.getX();
    }
}
