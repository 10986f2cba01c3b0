package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.codec.InvalidHexEncodingException;

import io.netty.buffer.ByteBufUtil;

import java.util.Objects;

/**
 * EwkbHex
 * -----------------------------------------------------------------------------
 * Converts the hexadecimal text form of (E)WKB into bytes.
 *
 * <p>PostGIS renders {@code geometry} values as upper-case hex EWKB, e.g.
 * {@code 0101000020E6100000...}. Both cases are accepted. Separators, a
 * {@code 0x} prefix and whitespace are not.</p>
 */
final class EwkbHex
{
    private EwkbHex() {}

    /**
     * Decodes hex digits into bytes.
     *
     * @throws InvalidHexEncodingException if the length is odd or a character
     *         is not a hex digit
     */
    static byte[] decode(CharSequence hex)
    {
        Objects.requireNonNull(hex, "hex");

        if ((hex.length() & 1) != 0) {
            throw new InvalidHexEncodingException(
                    "Hex input must have an even number of digits (was " + hex.length() + ")");
        }

        try {
            return ByteBufUtil.decodeHexDump(hex);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidHexEncodingException("Hex input contains a non-hex character", e);
        }
    }
}
