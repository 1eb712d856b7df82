package com.platnav.geometry;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link ShapeQueryProvider} over a set of {@link StaticShape}s.
 *
 * <p>Useful as the physics adapter for headless tools, level validation and tests.
 * Query semantics follow the common 2D physics engine conventions:
 * <ul>
 *   <li>Overlap queries compare axis-aligned bounds.</li>
 *   <li>A ray that starts inside a closed shape (box or polygon) hits it immediately,
 *       at the origin, with distance 0.</li>
 *   <li>Otherwise the closest segment crossing within range wins.</li>
 * </ul>
 *
 * <p>Not thread-safe. Populate it before generation and do not mutate it concurrently.
 */
@Slf4j
public class StaticShapeWorld implements ShapeQueryProvider {

    /**
     * Shapes by ID, in insertion order so query results are deterministic.
     */
    private final Map<Integer, StaticShape> shapes = new LinkedHashMap<>();

    /**
     * Add a shape, replacing any existing shape with the same ID.
     *
     * @param shape the shape to add
     * @return this world, for chaining
     */
    public StaticShapeWorld addShape(StaticShape shape) {
        if (shape == null) {
            throw new IllegalArgumentException("Shape cannot be null");
        }
        StaticShape previous = shapes.put(shape.getId(), shape);
        if (previous != null) {
            log.debug("Replaced shape {} ({} -> {})", shape.getId(), previous.getKind(), shape.getKind());
        }
        return this;
    }

    public boolean removeShape(int id) {
        return shapes.remove(id) != null;
    }

    public void clear() {
        shapes.clear();
    }

    public List<StaticShape> getShapes() {
        return Collections.unmodifiableList(new ArrayList<>(shapes.values()));
    }

    // ========================================================================
    // ShapeQueryProvider
    // ========================================================================

    @Override
    public List<StaticShape> overlapBox(Vec2 center, Vec2 size, int layerMask) {
        Region query = new Region(center, size);
        List<StaticShape> result = new ArrayList<>();
        for (StaticShape shape : shapes.values()) {
            if (shape.isOnLayer(layerMask) && shape.getBounds().overlaps(query)) {
                result.add(shape);
            }
        }
        return result;
    }

    @Override
    public Optional<RaycastHit> raycast(Vec2 origin, Vec2 direction, double maxDistance, int layerMask) {
        Vec2 dir = direction.normalized();
        if (dir.equals(Vec2.ZERO) || maxDistance < 0) {
            return Optional.empty();
        }

        StaticShape closestShape = null;
        double closestDistance = Double.POSITIVE_INFINITY;

        for (StaticShape shape : shapes.values()) {
            if (!shape.isOnLayer(layerMask)) {
                continue;
            }

            if (isClosed(shape) && Shapes.containsPoint(shape.getPaths(), origin)) {
                // Started inside: nothing can be closer than the origin itself
                return Optional.of(new RaycastHit(origin, shape, 0));
            }

            double distance = closestCrossing(shape, origin, dir, maxDistance);
            if (distance >= 0 && distance < closestDistance) {
                closestDistance = distance;
                closestShape = shape;
            }
        }

        if (closestShape == null) {
            return Optional.empty();
        }
        return Optional.of(new RaycastHit(origin.add(dir.scale(closestDistance)), closestShape, closestDistance));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static boolean isClosed(StaticShape shape) {
        return shape.getKind() != ShapeKind.POLYLINE;
    }

    /**
     * Closest crossing of the ray with any segment of the shape, or -1 if none within range.
     */
    private static double closestCrossing(StaticShape shape, Vec2 origin, Vec2 dir, double maxDistance) {
        boolean closed = isClosed(shape);
        double best = -1;

        for (List<Vec2> path : shape.getPaths()) {
            int n = path.size();
            if (n < 2) {
                continue;
            }
            int segments = closed ? n : n - 1;
            for (int i = 0; i < segments; i++) {
                Vec2 a = path.get(i);
                Vec2 b = path.get((i + 1) % n);
                double t = Shapes.raySegmentDistance(origin, dir, a, b);
                if (t >= 0 && t <= maxDistance && (best < 0 || t < best)) {
                    best = t;
                }
            }
        }
        return best;
    }
}
