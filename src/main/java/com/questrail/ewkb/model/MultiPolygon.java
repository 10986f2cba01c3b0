package com.questrail.ewkb.model;

import java.util.List;

/**
 * A collection of polygons.
 */
public record MultiPolygon(
        List<Polygon> polygons
) implements GeometryValue
{
    public MultiPolygon {
        polygons = List.copyOf(polygons);
    }

    @Override
    public GeometryType type() {
        return GeometryType.MULTIPOLYGON;
    }
}
