package com.questrail.ewkb.model;

import java.util.List;

/**
 * An ordered sequence of rings.
 *
 * <p>By WKB convention the first ring is the exterior and any further rings
 * are holes. Ring closure and orientation are not checked.</p>
 */
public record Polygon(
        List<LineString> rings
) implements GeometryValue
{
    public Polygon {
        rings = List.copyOf(rings);
    }

    @Override
    public GeometryType type() {
        return GeometryType.POLYGON;
    }
}
