package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.codec.InvalidByteOrderException;
import com.questrail.ewkb.codec.UnexpectedEndOfInputException;

import io.netty.buffer.ByteBuf;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * EwkbReader
 * -----------------------------------------------------------------------------
 * Sequential reader for the fixed-width primitives of the WKB encoding.
 *
 * <p>The reader keeps a cursor (the buffer's reader index) and the byte order
 * established by the most recent {@link #readByteOrder()}. Until the first
 * marker is read the order is big-endian.</p>
 *
 * <p>Every read checks the remaining length first and fails with
 * {@link UnexpectedEndOfInputException} instead of reading past the end.</p>
 *
 * <p>The cursor only moves forward. The reader does not own the buffer; the
 * caller releases it.</p>
 */
final class EwkbReader
{
    /** Byte order marker for XDR (big-endian). */
    static final int XDR = 0;

    /** Byte order marker for NDR (little-endian). */
    static final int NDR = 1;

    private final ByteBuf buffer;

    private ByteOrder order = ByteOrder.BIG_ENDIAN;

    EwkbReader(ByteBuf buffer)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    /**
     * Reads a byte order marker and applies it to all subsequent reads.
     *
     * @return the byte order selected by the marker
     * @throws InvalidByteOrderException if the marker is neither 0 nor 1
     */
    ByteOrder readByteOrder()
    {
        require(1);

        final int offset = buffer.readerIndex();
        final int marker = buffer.readUnsignedByte();

        switch (marker) {
            case NDR -> order = ByteOrder.LITTLE_ENDIAN;
            case XDR -> order = ByteOrder.BIG_ENDIAN;
            default -> throw new InvalidByteOrderException(marker, offset);
        }
        return order;
    }

    /**
     * Reads an unsigned 32-bit integer.
     */
    long readUInt32()
    {
        require(Integer.BYTES);
        return littleEndian() ? buffer.readUnsignedIntLE() : buffer.readUnsignedInt();
    }

    /**
     * Reads an IEEE-754 double.
     */
    double readFloat64()
    {
        require(Double.BYTES);
        return littleEndian() ? buffer.readDoubleLE() : buffer.readDouble();
    }

    /**
     * Reads an element count and checks it against the bytes left.
     *
     * <p>The check is made before any element is read, so a hostile count
     * cannot drive allocation beyond what the input could actually hold.</p>
     *
     * @param minElementBytes smallest possible encoded size of one element
     * @return the element count
     * @throws UnexpectedEndOfInputException if {@code count * minElementBytes}
     *         exceeds the remaining bytes
     */
    int readCount(int minElementBytes)
    {
        final long count = readUInt32();
        final long required = count * minElementBytes;

        if (required > buffer.readableBytes()) {
            throw new UnexpectedEndOfInputException(
                    buffer.readerIndex(), required, buffer.readableBytes());
        }
        return (int) count;
    }

    /**
     * Returns the byte order currently in effect.
     */
    ByteOrder order()
    {
        return order;
    }

    /**
     * Returns the cursor position from the start of the input.
     */
    int offset()
    {
        return buffer.readerIndex();
    }

    /**
     * Returns the number of unread bytes.
     */
    int remaining()
    {
        return buffer.readableBytes();
    }

    private boolean littleEndian()
    {
        return order == ByteOrder.LITTLE_ENDIAN;
    }

    private void require(int bytes)
    {
        if (buffer.readableBytes() < bytes) {
            throw new UnexpectedEndOfInputException(
                    buffer.readerIndex(), bytes, buffer.readableBytes());
        }
    }
}
