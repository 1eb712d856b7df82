package com.platnav.geometry;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

/**
 * Axis-aligned box collider.
 */
@Value
public class BoxShape implements StaticShape {

    int id;
    int layer;
    Vec2 center;
    Vec2 size;

    /**
     * Build a box from its minimum and maximum corners.
     */
    public static BoxShape fromMinMax(int id, int layer, double minX, double minY, double maxX, double maxY) {
        Region region = Region.fromMinMax(minX, minY, maxX, maxY);
        return new BoxShape(id, layer, region.getCenter(), region.getSize());
    }

    @Override
    public ShapeKind getKind() {
        return ShapeKind.BOX;
    }

    /**
     * The four corners, counter-clockwise from the bottom-left one.
     */
    @Override
    public List<List<Vec2>> getPaths() {
        Region bounds = getBounds();
        return ImmutableList.of(ImmutableList.of(
                new Vec2(bounds.getMinX(), bounds.getMinY()),
                new Vec2(bounds.getMaxX(), bounds.getMinY()),
                new Vec2(bounds.getMaxX(), bounds.getMaxY()),
                new Vec2(bounds.getMinX(), bounds.getMaxY())));
    }

    @Override
    public Region getBounds() {
        return new Region(center, size);
    }
}
