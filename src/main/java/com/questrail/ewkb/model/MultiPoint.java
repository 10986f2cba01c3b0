package com.questrail.ewkb.model;

import java.util.List;

/**
 * A collection of points.
 */
public record MultiPoint(
        List<Point> points
) implements GeometryValue
{
    public MultiPoint {
        points = List.copyOf(points);
    }

    @Override
    public GeometryType type() {
        return GeometryType.MULTIPOINT;
    }
}
