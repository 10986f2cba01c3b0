package com.questrail.ewkb.codec.impl;

import com.questrail.ewkb.codec.UnsupportedTypeException;
import com.questrail.ewkb.model.GeometryType;

/**
 * EwkbTypeCode
 * -----------------------------------------------------------------------------
 * Bit layout of the 32-bit EWKB type word.
 *
 * <p>The low bits hold the geometry kind (1..7). PostGIS reuses the three high
 * bits as flags:</p>
 * <ul>
 *   <li>{@code 0x20000000}: an SRID follows the type word</li>
 *   <li>{@code 0x40000000}: coordinates carry an M value</li>
 *   <li>{@code 0x80000000}: coordinates carry a Z value</li>
 * </ul>
 *
 * <p>Only the SRID flag is cleared before classification. A type word still
 * carrying Z or M does not match any supported kind and is rejected, so 3-D
 * and measured coordinates are never misread as 2-D.</p>
 *
 * <p>Type words are handled as {@code long} to keep them unsigned.</p>
 */
final class EwkbTypeCode
{
    static final long SRID_FLAG = 0x20000000L;

    static final long M_FLAG = 0x40000000L;

    static final long Z_FLAG = 0x80000000L;

    private EwkbTypeCode() {}

    static boolean hasFlag(long rawType, long flag)
    {
        return (rawType & flag) == flag;
    }

    static boolean hasSrid(long rawType)
    {
        return hasFlag(rawType, SRID_FLAG);
    }

    static long clearSrid(long rawType)
    {
        return rawType & ~SRID_FLAG;
    }

    /**
     * Maps a type word with the SRID flag cleared to its geometry type.
     *
     * @param rawType unsigned type word, SRID flag already cleared
     * @return the geometry type
     * @throws UnsupportedTypeException if the word is not one of the codes 1..7
     */
    static GeometryType classify(long rawType)
    {
        if (hasFlag(rawType, Z_FLAG) || hasFlag(rawType, M_FLAG)) {
            throw new UnsupportedTypeException(rawType, "Z/M coordinates are not supported");
        }

        final GeometryType type = GeometryType.fromCode(rawType);
        if (type == null) {
            throw new UnsupportedTypeException(rawType);
        }
        return type;
    }
}
