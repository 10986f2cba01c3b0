package com.questrail.ewkb.codec;

/**
 * Hex-encoded input had an odd number of digits or a non-hex character.
 */
public final class InvalidHexEncodingException extends EwkbDecodeException
{
    public InvalidHexEncodingException(String message) {
        super(message);
    }

    public InvalidHexEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
