package com.questrail.ewkb.codec;

/**
 * The input ended before a field (or a declared number of elements) could be
 * read in full.
 */
public final class UnexpectedEndOfInputException extends EwkbDecodeException
{
    private final int offset;
    private final long required;
    private final int available;

    public UnexpectedEndOfInputException(int offset, long required, int available) {
        super("Unexpected end of input at offset " + offset
                + ": " + required + " byte(s) required, " + available + " available");
        this.offset = offset;
        this.required = required;
        this.available = available;
    }

    /**
     * Returns the offset at which the read was attempted.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the number of bytes the read needed.
     */
    public long required() {
        return required;
    }

    /**
     * Returns the number of bytes that were left.
     */
    public int available() {
        return available;
    }
}
