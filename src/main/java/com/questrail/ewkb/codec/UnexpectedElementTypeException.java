package com.questrail.ewkb.codec;

import com.questrail.ewkb.model.GeometryType;

/**
 * An element of a {@code MULTIPOINT}, {@code MULTILINESTRING} or
 * {@code MULTIPOLYGON} declared a type other than the container's element type.
 */
public final class UnexpectedElementTypeException extends EwkbDecodeException
{
    private final GeometryType container;
    private final GeometryType expected;
    private final GeometryType actual;

    public UnexpectedElementTypeException(GeometryType container,
                                          GeometryType expected,
                                          GeometryType actual) {
        super(container + " element must be " + expected + " but was " + actual);
        this.container = container;
        this.expected = expected;
        this.actual = actual;
    }

    public GeometryType container() {
        return container;
    }

    public GeometryType expected() {
        return expected;
    }

    public GeometryType actual() {
        return actual;
    }
}
