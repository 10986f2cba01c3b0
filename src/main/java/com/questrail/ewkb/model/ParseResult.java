package com.questrail.ewkb.model;

import java.util.Objects;

/**
 * Outcome of decoding one EWKB value.
 *
 * <h2>SRID semantics</h2>
 * <p>
 * {@code srid} is non-null only if at least one header read during the decode
 * carried the SRID flag. It is never defaulted to zero. When nested headers
 * also carry SRIDs, the value read last is reported.
 * </p>
 *
 * <p>
 * The SRID is an unsigned 32-bit value on the wire and is therefore held in a
 * {@code Long}.
 * </p>
 *
 * @param type  tag of the top-level geometry
 * @param value decoded geometry
 * @param srid  spatial reference identifier, or {@code null} if absent
 */
public record ParseResult(
        GeometryType type,
        GeometryValue value,
        Long srid
) {
    public ParseResult {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");

        if (value.type() != type) {
            throw new IllegalArgumentException(
                    "type " + type + " does not match value type " + value.type());
        }
    }

    /**
     * Creates a result whose type is taken from {@code value}.
     */
    public static ParseResult of(GeometryValue value, Long srid) {
        Objects.requireNonNull(value, "value");
        return new ParseResult(value.type(), value, srid);
    }

    /**
     * Indicates whether an SRID was present in the input.
     */
    public boolean hasSrid() {
        return srid != null;
    }
}
