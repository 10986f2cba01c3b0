/**
 * EWKB Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete decoder that turns WKB/EWKB bytes into
 * the geometry model.</p>
 *
 * <h2>Normative Authority</h2>
 * <p>The layout follows OGC Simple Features Access, Part 1, section 8.2 (WKB),
 * extended with the PostGIS EWKB flag bits for SRID, Z and M.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] / hex text
 *        → EwkbHex.decode              (hex input only)
 *        → EwkbReader                  (byte order, uint32, float64)
 *        → EwkbTypeCode.classify       (flag handling, kind lookup)
 *        → DefaultEwkbGeometryDecoder  (recursive payload rules)
 *        → ParseResult
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty buffer types are used to read the input but MUST NOT escape this
 * package.</p>
 *
 * <p>Any failure at this layer aborts the decode with an
 * {@link com.questrail.ewkb.codec.EwkbDecodeException}.</p>
 */
package com.questrail.ewkb.codec.impl;
