package com.questrail.ewkb.codec;

/**
 * Nested geometry headers went deeper than the configured maximum.
 *
 * @see com.questrail.ewkb.config.EwkbDecoderConfig#maxNestingDepth()
 */
public final class NestingDepthExceededException extends EwkbDecodeException
{
    private final int maxDepth;

    public NestingDepthExceededException(int maxDepth) {
        super("Geometry nesting exceeds maximum depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
