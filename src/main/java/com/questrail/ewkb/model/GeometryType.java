package com.questrail.ewkb.model;

/**
 * The seven geometry kinds understood by the decoder.
 *
 * <p>Each constant carries its numeric WKB type code (OGC Simple Features,
 * section 8.2.8). The constant name doubles as the canonical upper-case tag
 * reported in decode results, e.g. {@code "LINESTRING"}.</p>
 *
 * <p>The codes here are the bare 2-D codes. Extension flags (SRID, Z, M) are
 * handled by the codec layer before a code reaches {@link #fromCode(long)}.</p>
 */
public enum GeometryType
{
    POINT(1),
    LINESTRING(2),
    POLYGON(3),
    MULTIPOINT(4),
    MULTILINESTRING(5),
    MULTIPOLYGON(6),
    GEOMETRYCOLLECTION(7);

    private static final GeometryType[] BY_CODE = new GeometryType[8];

    static {
        for (GeometryType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    GeometryType(int code)
    {
        this.code = code;
    }

    /**
     * Returns the WKB type code (1..7).
     */
    public int code()
    {
        return code;
    }

    /**
     * Returns the canonical upper-case tag, e.g. {@code "MULTIPOLYGON"}.
     */
    public String tag()
    {
        return name();
    }

    /**
     * Looks up the geometry type for a bare WKB type code.
     *
     * @param code type code with all flag bits already cleared
     * @return the matching type, or {@code null} if the code is not one of 1..7
     */
    public static GeometryType fromCode(long code)
    {
        if (code < 1 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[(int) code];
    }
}
