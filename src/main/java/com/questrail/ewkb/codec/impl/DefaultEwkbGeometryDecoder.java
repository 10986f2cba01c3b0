package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.codec.EwkbDecodeException;
import com.questrail.ewkb.codec.EwkbGeometryDecoder;
import com.questrail.ewkb.codec.NestingDepthExceededException;
import com.questrail.ewkb.codec.TrailingBytesException;
import com.questrail.ewkb.codec.UnexpectedElementTypeException;
import com.questrail.ewkb.config.EwkbDecoderConfig;
import com.questrail.ewkb.model.*;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultEwkbGeometryDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EwkbGeometryDecoder}.
 *
 * <p>Each geometry header is decoded in this order:</p>
 * <ol>
 *   <li>Byte order marker, which governs every read up to the next header</li>
 *   <li>Type word; if the SRID flag is set it is cleared and the SRID is read</li>
 *   <li>Classification of the remaining code into a {@link GeometryType}</li>
 *   <li>Type-specific payload, recursing for {@code Multi*} and collection
 *       elements, each of which carries a full header of its own</li>
 * </ol>
 *
 * <p><strong>Payload rules</strong>:</p>
 * <ul>
 *   <li>POINT: two doubles</li>
 *   <li>LINESTRING: count, then that many points</li>
 *   <li>POLYGON: count, then that many rings (line string payloads)</li>
 *   <li>MULTIPOINT / MULTILINESTRING / MULTIPOLYGON: count, then that many
 *       nested geometries of the element type; only their values are kept</li>
 *   <li>GEOMETRYCOLLECTION: count, then that many nested geometries of any
 *       type</li>
 * </ul>
 *
 * <p><strong>SRID</strong>: the SRID reported is the last one read during the
 * call, whether it came from the top-level header or a nested one.</p>
 *
 * <p>All per-call state lives in a {@link DecodeContext}, so one instance can
 * serve concurrent callers.</p>
 */
public final class DefaultEwkbGeometryDecoder implements EwkbGeometryDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultEwkbGeometryDecoder.class);

    /** Encoded size of one 2-D coordinate. */
    private static final int POINT_BYTES = 2 * Double.BYTES;

    /** Encoded size of an empty ring: just its count. */
    private static final int RING_BYTES = Integer.BYTES;

    /** Encoded size of the smallest possible nested header. */
    private static final int HEADER_BYTES = 1 + Integer.BYTES;

    private final EwkbDecoderConfig config;

    public DefaultEwkbGeometryDecoder()
    {
        this(EwkbDecoderConfig.defaults());
    }

    public DefaultEwkbGeometryDecoder(EwkbDecoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EwkbDecoderConfig config()
    {
        return config;
    }

    @Override
    public ParseResult decode(byte[] ewkb)
    {
        Objects.requireNonNull(ewkb, "ewkb");

        final ByteBuf buffer = Unpooled.wrappedBuffer(ewkb);
        try {
            final DecodeContext ctx = new DecodeContext(new EwkbReader(buffer));
            final GeometryValue value = decodeGeometry(ctx, 0);

            if (config.rejectTrailingBytes() && ctx.reader.remaining() > 0) {
                throw new TrailingBytesException(ctx.reader.offset(), ctx.reader.remaining());
            }

            final ParseResult result = ParseResult.of(value, ctx.srid);
            log.trace("Decoded {} (srid={}) from {} bytes", result.type(), result.srid(), ewkb.length);
            return result;
        }
        finally {
            buffer.release();
        }
    }

    @Override
    public ParseResult decodeHex(CharSequence hex)
    {
        return decode(EwkbHex.decode(hex));
    }

    @Override
    public Optional<ParseResult> tryDecode(byte[] ewkb)
    {
        Objects.requireNonNull(ewkb, "ewkb");

        try {
            return Optional.of(decode(ewkb));
        }
        catch (EwkbDecodeException e) {
            log.debug("Dropping undecodable geometry ({} bytes): {}", ewkb.length, e.getMessage(), e);
            return Optional.empty();
        }
    }

    // ========================================================================
    // Header
    // ========================================================================

    private GeometryValue decodeGeometry(DecodeContext ctx, int depth)
    {
        if (depth > config.maxNestingDepth()) {
            throw new NestingDepthExceededException(config.maxNestingDepth());
        }

        final EwkbReader reader = ctx.reader;

        reader.readByteOrder();
        long rawType = reader.readUInt32();

        if (EwkbTypeCode.hasSrid(rawType)) {
            rawType = EwkbTypeCode.clearSrid(rawType);
            ctx.srid = reader.readUInt32();
        }

        final GeometryType type = EwkbTypeCode.classify(rawType);

        return switch (type) {
            case POINT -> readPoint(reader);
            case LINESTRING -> readLineString(reader);
            case POLYGON -> readPolygon(reader);
            case MULTIPOINT -> new MultiPoint(
                    readElements(ctx, depth, type, GeometryType.POINT, Point.class));
            case MULTILINESTRING -> new MultiLineString(
                    readElements(ctx, depth, type, GeometryType.LINESTRING, LineString.class));
            case MULTIPOLYGON -> new MultiPolygon(
                    readElements(ctx, depth, type, GeometryType.POLYGON, Polygon.class));
            case GEOMETRYCOLLECTION -> new GeometryCollection(readGeometries(ctx, depth));
        };
    }

    // ========================================================================
    // Flat payloads
    // ========================================================================

    private static Point readPoint(EwkbReader reader)
    {
        final double x = reader.readFloat64();
        final double y = reader.readFloat64();
        return new Point(x, y);
    }

    private static LineString readLineString(EwkbReader reader)
    {
        final int count = reader.readCount(POINT_BYTES);
        final List<Point> points = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            points.add(readPoint(reader));
        }
        return new LineString(points);
    }

    private static Polygon readPolygon(EwkbReader reader)
    {
        final int count = reader.readCount(RING_BYTES);
        final List<LineString> rings = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            rings.add(readLineString(reader));
        }
        return new Polygon(rings);
    }

    // ========================================================================
    // Nested payloads
    // ========================================================================

    private <T extends GeometryValue> List<T> readElements(DecodeContext ctx,
                                                           int depth,
                                                           GeometryType container,
                                                           GeometryType elementType,
                                                           Class<T> elementClass)
    {
        final int count = ctx.reader.readCount(HEADER_BYTES);
        final List<T> elements = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            final GeometryValue element = decodeGeometry(ctx, depth + 1);
            if (element.type() != elementType) {
                throw new UnexpectedElementTypeException(container, elementType, element.type());
            }
            elements.add(elementClass.cast(element));
        }
        return elements;
    }

    private List<GeometryValue> readGeometries(DecodeContext ctx, int depth)
    {
        final int count = ctx.reader.readCount(HEADER_BYTES);
        final List<GeometryValue> geometries = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            geometries.add(decodeGeometry(ctx, depth + 1));
        }
        return geometries;
    }

    /**
     * State owned by a single {@link #decode(byte[])} call.
     */
    private static final class DecodeContext
    {
        private final EwkbReader reader;

        /** Last SRID read by any header in this call; null until one is seen. */
        private Long srid;

        private DecodeContext(EwkbReader reader)
        {
            this.reader = reader;
        }
    }
}
