package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.codec.InvalidByteOrderException;
import com.questrail.ewkb.codec.UnexpectedEndOfInputException;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EwkbReaderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link EwkbReader}: byte order switching, unsigned integers,
 * doubles and bounds checking.
 */
final class EwkbReaderTest
{
    private static EwkbReader reader(String hex)
    {
        return new EwkbReader(Unpooled.wrappedBuffer(ByteBufUtil.decodeHexDump(hex)));
    }

    @Test
    void defaultsToBigEndianBeforeFirstMarker()
    {
        EwkbReader r = reader("00000001");

        assertEquals(ByteOrder.BIG_ENDIAN, r.order());
        assertEquals(1L, r.readUInt32());
    }

    @Test
    void markerOneSelectsLittleEndian()
    {
        EwkbReader r = reader("01" + "01000000");

        assertEquals(ByteOrder.LITTLE_ENDIAN, r.readByteOrder());
        assertEquals(1L, r.readUInt32());
    }

    @Test
    void markerZeroSelectsBigEndian()
    {
        EwkbReader r = reader("00" + "00000001");

        assertEquals(ByteOrder.BIG_ENDIAN, r.readByteOrder());
        assertEquals(1L, r.readUInt32());
    }

    @Test
    void byteOrderAppliesUntilNextMarker()
    {
        EwkbReader r = reader("01" + "02000000" + "03000000" + "00" + "00000004");

        r.readByteOrder();
        assertEquals(2L, r.readUInt32());
        assertEquals(3L, r.readUInt32());

        r.readByteOrder();
        assertEquals(4L, r.readUInt32());
    }

    @Test
    void readsUInt32AsUnsigned()
    {
        EwkbReader r = reader("FFFFFFFF");

        assertEquals(0xFFFFFFFFL, r.readUInt32());
    }

    @Test
    void readsFloat64InBothOrders()
    {
        EwkbReader r = reader("01" + "000000000000F83F" + "00" + "C002000000000000");

        r.readByteOrder();
        assertEquals(1.5, r.readFloat64());
        r.readByteOrder();
        assertEquals(-2.25, r.readFloat64());
    }

    @Test
    void rejectsUnknownByteOrderMarker()
    {
        EwkbReader r = reader("02");

        InvalidByteOrderException e = assertThrows(InvalidByteOrderException.class, r::readByteOrder);
        assertEquals(2, e.marker());
        assertEquals(0, e.offset());
    }

    @Test
    void rejectsByteOrderOnEmptyInput()
    {
        EwkbReader r = reader("");

        UnexpectedEndOfInputException e =
                assertThrows(UnexpectedEndOfInputException.class, r::readByteOrder);
        assertEquals(0, e.offset());
        assertEquals(1, e.required());
        assertEquals(0, e.available());
    }

    @Test
    void rejectsShortUInt32()
    {
        EwkbReader r = reader("000000");

        UnexpectedEndOfInputException e =
                assertThrows(UnexpectedEndOfInputException.class, r::readUInt32);
        assertEquals(4, e.required());
        assertEquals(3, e.available());
    }

    @Test
    void rejectsShortFloat64AndDoesNotAdvance()
    {
        EwkbReader r = reader("00000000000000");

        assertThrows(UnexpectedEndOfInputException.class, r::readFloat64);
        assertEquals(0, r.offset());
        assertEquals(7, r.remaining());
    }

    @Test
    void readCountAcceptsCountThatFits()
    {
        // two 16-byte elements follow
        EwkbReader r = reader("00000002" + "00".repeat(32));

        assertEquals(2, r.readCount(16));
        assertEquals(4, r.offset());
    }

    @Test
    void readCountRejectsCountLargerThanInput()
    {
        EwkbReader r = reader("FFFFFFFF" + "00".repeat(16));

        UnexpectedEndOfInputException e =
                assertThrows(UnexpectedEndOfInputException.class, () -> r.readCount(16));
        assertEquals(4, e.offset());
        assertEquals(0xFFFFFFFFL * 16, e.required());
        assertEquals(16, e.available());
    }

    @Test
    void offsetAndRemainingTrackCursor()
    {
        EwkbReader r = reader("01" + "01000000" + "0000");

        r.readByteOrder();
        r.readUInt32();

        assertEquals(5, r.offset());
        assertEquals(2, r.remaining());
    }
}
