package com.questrail.ewkb.model;

/**
 * A 2-D coordinate.
 *
 * <p>Only x and y are represented. Inputs flagged with Z or M dimensions are
 * rejected by the decoder rather than truncated.</p>
 *
 * <p>Equality follows {@link Double#compare}, so {@code NaN} coordinates (as
 * used by some writers for {@code POINT EMPTY}) compare equal to themselves.</p>
 */
public record Point(
        double x,
        double y
) implements GeometryValue
{
    @Override
    public GeometryType type() {
        return GeometryType.POINT;
    }
}
