package com.questrail.ewkb.codec;

import com.questrail.ewkb.model.ParseResult;

import java.util.Optional;

/**
 * EwkbGeometryDecoder
 * -----------------------------------------------------------------------------
 * Decoder for a single WKB/EWKB encoded geometry.
 *
 * <p>This interface is the boundary between raw bytes (as read from a database
 * column, a file or a message) and the immutable geometry model in
 * {@code com.questrail.ewkb.model}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Interpreting byte order markers and type headers</li>
 *   <li>Reading the type-specific payload, recursing into nested geometries</li>
 *   <li>Detecting truncation and malformed headers</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Validating geometric well-formedness (ring closure, self-intersection)</li>
 *   <li>Coordinate reference system handling beyond reporting the SRID</li>
 *   <li>Buffering or reassembling partial input</li>
 * </ul>
 *
 * <p>Implementations hold no per-call state and may be shared between
 * threads.</p>
 */
public interface EwkbGeometryDecoder
{
    /**
     * Decode one geometry from a complete buffer.
     *
     * @param ewkb WKB or EWKB bytes
     * @return the decoded geometry and its SRID, if any
     * @throws EwkbDecodeException if the input is not a valid geometry
     */
    ParseResult decode(byte[] ewkb);

    /**
     * Decode one geometry from its hexadecimal text form, as produced by
     * PostGIS for {@code geometry} columns.
     *
     * @param hex hex digits, either case, no separators
     * @return the decoded geometry and its SRID, if any
     * @throws InvalidHexEncodingException if {@code hex} is not valid hex
     * @throws EwkbDecodeException if the decoded bytes are not a valid geometry
     */
    ParseResult decodeHex(CharSequence hex);

    /**
     * Attempt to decode one geometry, dropping the input on failure.
     *
     * @param ewkb WKB or EWKB bytes
     * @return the result, or {@link Optional#empty()} if decoding failed
     */
    Optional<ParseResult> tryDecode(byte[] ewkb);
}
