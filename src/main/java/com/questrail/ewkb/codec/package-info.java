/**
 * EWKB Codec: Public Decoding Contract
 * =============================================================================
 *
 * <p>This package defines the decoding boundary for Well-Known Binary (WKB)
 * and its PostGIS extension (EWKB), together with the exceptions raised when
 * input is rejected.</p>
 *
 * <h2>Wire Format</h2>
 * <pre>
 *   byte    byteOrder   0 = XDR (big-endian), 1 = NDR (little-endian)
 *   uint32  type        kind 1..7, plus flags:
 *                         0x20000000  SRID follows
 *                         0x40000000  M dimension
 *                         0x80000000  Z dimension
 *   uint32  srid        only if the SRID flag is set
 *   ...     payload     per kind; nested geometries repeat this layout
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] / hex text
 *        → EwkbGeometryDecoder   (wire rules applied here)
 *            → ParseResult       (GeometryValue tree + SRID)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Only 2-D geometries are decoded. Z/M flagged headers are rejected
 *       with {@link com.questrail.ewkb.codec.UnsupportedTypeException}.</li>
 *   <li>Buffer types used internally (Netty {@code ByteBuf}) never appear in
 *       this package's API.</li>
 * </ul>
 */
package com.questrail.ewkb.codec;
