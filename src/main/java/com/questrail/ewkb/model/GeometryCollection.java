package com.questrail.ewkb.model;

import java.util.List;

/**
 * A heterogeneous collection of geometries.
 *
 * <p>
 * Unlike the {@code Multi*} types, each element keeps its own tag, so a
 * collection may mix points, polygons and even nested collections.
 * </p>
 */
public record GeometryCollection(
        List<GeometryValue> geometries
) implements GeometryValue
{
    public GeometryCollection {
        geometries = List.copyOf(geometries);
    }

    @Override
    public GeometryType type() {
        return GeometryType.GEOMETRYCOLLECTION;
    }
}
