package com.questrail.ewkb.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ParseResultTest
{
    @Test
    void ofTakesTypeFromValue()
    {
        ParseResult result = ParseResult.of(new MultiPoint(List.of()), 4326L);

        assertEquals(GeometryType.MULTIPOINT, result.type());
        assertEquals(4326L, result.srid());
        assertTrue(result.hasSrid());
    }

    @Test
    void absentSridIsNull()
    {
        ParseResult result = ParseResult.of(new Point(1, 2), null);

        assertNull(result.srid());
        assertFalse(result.hasSrid());
    }

    @Test
    void rejectsMismatchedType()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new ParseResult(GeometryType.POLYGON, new Point(1, 2), null));
    }

    @Test
    void rejectsNullTypeOrValue()
    {
        assertThrows(NullPointerException.class, () -> new ParseResult(null, new Point(1, 2), null));
        assertThrows(NullPointerException.class, () -> new ParseResult(GeometryType.POINT, null, null));
        assertThrows(NullPointerException.class, () -> ParseResult.of(null, null));
    }

    @Test
    void toStringShowsCanonicalTag()
    {
        String text = ParseResult.of(new Point(1.5, -2.25), 4326L).toString();

        assertTrue(text.contains("type=POINT"), text);
        assertTrue(text.contains("srid=4326"), text);
    }
}
