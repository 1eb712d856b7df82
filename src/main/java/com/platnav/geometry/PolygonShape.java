package com.platnav.geometry;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

/**
 * Closed polygon collider made of one or more loops.
 *
 * <p>Loops are implicitly closed (last point connects back to the first). Several loops
 * share one identity, as produced by composite or tile colliders.
 */
@Value
public class PolygonShape implements StaticShape {

    int id;
    int layer;
    List<List<Vec2>> paths;

    public PolygonShape(int id, int layer, List<List<Vec2>> paths) {
        this.id = id;
        this.layer = layer;
        ImmutableList.Builder<List<Vec2>> copy = ImmutableList.builder();
        for (List<Vec2> path : paths) {
            copy.add(ImmutableList.copyOf(path));
        }
        this.paths = copy.build();
    }

    /**
     * Convenience factory for a single-loop polygon.
     */
    public static PolygonShape of(int id, int layer, List<Vec2> points) {
        return new PolygonShape(id, layer, ImmutableList.of(points));
    }

    @Override
    public ShapeKind getKind() {
        return ShapeKind.POLYGON;
    }

    @Override
    public Region getBounds() {
        return Shapes.boundsOf(paths);
    }
}
