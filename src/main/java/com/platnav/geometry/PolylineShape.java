package com.platnav.geometry;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

/**
 * Open polyline collider (edge collider). Has no interior.
 */
@Value
public class PolylineShape implements StaticShape {

    int id;
    int layer;
    List<Vec2> points;

    public PolylineShape(int id, int layer, List<Vec2> points) {
        this.id = id;
        this.layer = layer;
        this.points = ImmutableList.copyOf(points);
    }

    @Override
    public ShapeKind getKind() {
        return ShapeKind.POLYLINE;
    }

    @Override
    public List<List<Vec2>> getPaths() {
        return ImmutableList.of(points);
    }

    @Override
    public Region getBounds() {
        return Shapes.boundsOf(getPaths());
    }
}
