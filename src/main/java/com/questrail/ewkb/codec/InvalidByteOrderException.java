package com.questrail.ewkb.codec;

/**
 * A geometry header started with a byte order marker other than
 * {@code 0} (XDR, big-endian) or {@code 1} (NDR, little-endian).
 */
public final class InvalidByteOrderException extends EwkbDecodeException
{
    private final int marker;
    private final int offset;

    public InvalidByteOrderException(int marker, int offset) {
        super(String.format("Invalid byte order marker 0x%02X at offset %d", marker, offset));
        this.marker = marker;
        this.offset = offset;
    }

    /**
     * Returns the unsigned marker byte that was read.
     */
    public int marker() {
        return marker;
    }

    /**
     * Returns the offset of the marker byte within the input.
     */
    public int offset() {
        return offset;
    }
}
