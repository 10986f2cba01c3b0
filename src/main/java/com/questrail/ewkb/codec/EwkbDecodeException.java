package com.questrail.ewkb.codec;

/**
 * Indicates that a byte sequence could not be decoded as a WKB/EWKB geometry.
 *
 * <p>This is the common supertype of every decode failure. Concrete subclasses
 * identify the failure kind:</p>
 * <ul>
 *   <li>{@link InvalidByteOrderException}</li>
 *   <li>{@link UnsupportedTypeException}</li>
 *   <li>{@link UnexpectedEndOfInputException}</li>
 *   <li>{@link UnexpectedElementTypeException}</li>
 *   <li>{@link NestingDepthExceededException}</li>
 *   <li>{@link TrailingBytesException}</li>
 *   <li>{@link InvalidHexEncodingException}</li>
 * </ul>
 *
 * All of them abort the whole decode; no partial geometry is ever returned.
 */
public abstract class EwkbDecodeException extends RuntimeException
{
    protected EwkbDecodeException(String message) {
        super(message);
    }

    protected EwkbDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
