package com.questrail.ewkb.codec;

/**
 * The type code of a geometry header, after clearing the SRID flag, is not one
 * of the seven supported 2-D codes.
 *
 * <p>This covers unknown kinds (e.g. curves, ISO {@code 1000}-series codes) as
 * well as codes carrying the EWKB Z or M dimension flags, which are not
 * decoded.</p>
 */
public final class UnsupportedTypeException extends EwkbDecodeException
{
    private final long typeCode;

    public UnsupportedTypeException(long typeCode) {
        super(String.format("Unsupported WKB type \"%d\" (0x%08X)", typeCode, typeCode));
        this.typeCode = typeCode;
    }

    public UnsupportedTypeException(long typeCode, String detail) {
        super(String.format("Unsupported WKB type \"%d\" (0x%08X): %s", typeCode, typeCode, detail));
        this.typeCode = typeCode;
    }

    /**
     * Returns the unsigned type code with the SRID flag cleared.
     */
    public long typeCode() {
        return typeCode;
    }
}
