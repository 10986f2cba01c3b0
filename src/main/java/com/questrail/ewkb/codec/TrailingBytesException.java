package com.questrail.ewkb.codec;

/**
 * Bytes remained after the top-level geometry was decoded and the decoder was
 * configured to reject them.
 *
 * @see com.questrail.ewkb.config.EwkbDecoderConfig#rejectTrailingBytes()
 */
public final class TrailingBytesException extends EwkbDecodeException
{
    private final int offset;
    private final int trailing;

    public TrailingBytesException(int offset, int trailing) {
        super(trailing + " trailing byte(s) after geometry ending at offset " + offset);
        this.offset = offset;
        this.trailing = trailing;
    }

    /**
     * Returns the offset at which the geometry ended.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the number of unread bytes.
     */
    public int trailing() {
        return trailing;
    }
}
