package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.model.*;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;

/**
 * Test-only EWKB writer used to build decoder fixtures.
 *
 * <p>Supports both whole-geometry encoding from the model and byte-by-byte
 * construction for malformed or mixed-order inputs.</p>
 */
final class EwkbTestWriter
{
    private final ByteBuf buf = Unpooled.buffer();
    private ByteOrder order = ByteOrder.BIG_ENDIAN;

    static byte[] encode(GeometryValue value, ByteOrder order)
    {
        return encode(value, order, null);
    }

    static byte[] encode(GeometryValue value, ByteOrder order, Long srid)
    {
        return new EwkbTestWriter().geometry(value, order, srid).toByteArray();
    }

    EwkbTestWriter header(ByteOrder order, long typeCode, Long srid)
    {
        this.order = order;
        buf.writeByte(order == ByteOrder.LITTLE_ENDIAN ? EwkbReader.NDR : EwkbReader.XDR);

        uint32(srid == null ? typeCode : typeCode | EwkbTypeCode.SRID_FLAG);
        if (srid != null) {
            uint32(srid);
        }
        return this;
    }

    EwkbTestWriter geometry(GeometryValue value, ByteOrder order, Long srid)
    {
        header(order, value.type().code(), srid);

        if (value instanceof Point p) {
            point(p);
        }
        else if (value instanceof LineString ls) {
            lineString(ls);
        }
        else if (value instanceof Polygon pg) {
            polygon(pg);
        }
        else if (value instanceof MultiPoint mp) {
            uint32(mp.points().size());
            mp.points().forEach(p -> geometry(p, order, null));
        }
        else if (value instanceof MultiLineString mls) {
            uint32(mls.lineStrings().size());
            mls.lineStrings().forEach(ls -> geometry(ls, order, null));
        }
        else if (value instanceof MultiPolygon mpg) {
            uint32(mpg.polygons().size());
            mpg.polygons().forEach(pg -> geometry(pg, order, null));
        }
        else if (value instanceof GeometryCollection gc) {
            uint32(gc.geometries().size());
            gc.geometries().forEach(g -> geometry(g, order, null));
        }
        return this;
    }

    EwkbTestWriter uint32(long value)
    {
        if (order == ByteOrder.LITTLE_ENDIAN) {
            buf.writeIntLE((int) value);
        }
        else {
            buf.writeInt((int) value);
        }
        return this;
    }

    EwkbTestWriter float64(double value)
    {
        if (order == ByteOrder.LITTLE_ENDIAN) {
            buf.writeDoubleLE(value);
        }
        else {
            buf.writeDouble(value);
        }
        return this;
    }

    EwkbTestWriter rawByte(int value)
    {
        buf.writeByte(value);
        return this;
    }

    byte[] toByteArray()
    {
        try {
            return ByteBufUtil.getBytes(buf);
        }
        finally {
            buf.release();
        }
    }

    private void point(Point p)
    {
        float64(p.x());
        float64(p.y());
    }

    private void lineString(LineString ls)
    {
        uint32(ls.points().size());
        ls.points().forEach(this::point);
    }

    private void polygon(Polygon pg)
    {
        uint32(pg.rings().size());
        pg.rings().forEach(this::lineString);
    }
}
