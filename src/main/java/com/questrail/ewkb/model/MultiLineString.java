package com.questrail.ewkb.model;

import java.util.List;

/**
 * A collection of line strings.
 */
public record MultiLineString(
        List<LineString> lineStrings
) implements GeometryValue
{
    public MultiLineString {
        lineStrings = List.copyOf(lineStrings);
    }

    @Override
    public GeometryType type() {
        return GeometryType.MULTILINESTRING;
    }
}
