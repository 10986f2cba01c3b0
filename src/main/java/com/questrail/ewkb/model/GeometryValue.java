package com.questrail.ewkb.model;

/**
 * Decoded geometry value.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code GeometryValue} is the tagged union produced by the decoder. The tag is
 * given by {@link #type()}; the payload shape is fixed by the implementing
 * record:
 * </p>
 * <ul>
 *   <li>{@link Point}: a pair of doubles</li>
 *   <li>{@link LineString}: a sequence of points</li>
 *   <li>{@link Polygon}: a sequence of rings</li>
 *   <li>{@link MultiPoint}, {@link MultiLineString}, {@link MultiPolygon}:
 *       sequences of the singular payload, with per-element headers dropped</li>
 *   <li>{@link GeometryCollection}: a sequence of full nested values</li>
 * </ul>
 *
 * <p>
 * All implementations are immutable. Lists exposed by them are unmodifiable.
 * Wire-level details (byte order, flag bits, SRIDs of nested headers) are not
 * represented here.
 * </p>
 */
public sealed interface GeometryValue
        permits Point, LineString, Polygon,
                MultiPoint, MultiLineString, MultiPolygon,
                GeometryCollection {

    /**
     * Returns the tag of this value.
     *
     * @return the geometry type, never {@code null}
     */
    GeometryType type();
}
