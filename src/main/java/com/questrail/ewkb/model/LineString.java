package com.questrail.ewkb.model;

import java.util.List;

/**
 * An ordered sequence of points.
 *
 * <p>No minimum point count is enforced; an empty line string is legal on the
 * wire and is decoded as such.</p>
 */
public record LineString(
        List<Point> points
) implements GeometryValue
{
    public LineString {
        points = List.copyOf(points);
    }

    @Override
    public GeometryType type() {
        return GeometryType.LINESTRING;
    }
}
