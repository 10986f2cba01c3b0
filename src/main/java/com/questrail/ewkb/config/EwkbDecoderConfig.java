package com.questrail.ewkb.config;

/**
 * EwkbDecoderConfig
 * -----------------------------------------------------------------------------
 * Limits and policies applied by the geometry decoder.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxNestingDepth</b> — Maximum depth of nested geometry headers. The
 *       top-level geometry is depth 0; each element of a {@code Multi*} or
 *       {@code GEOMETRYCOLLECTION} is one level deeper than its container.
 *       Bounds recursion on hostile input.</li>
 *   <li><b>rejectTrailingBytes</b> — If {@code true}, input that continues
 *       past the end of the top-level geometry is rejected. If {@code false},
 *       trailing bytes are ignored.</li>
 * </ul>
 */
public record EwkbDecoderConfig(
        int maxNestingDepth,
        boolean rejectTrailingBytes
) {
    /** Default for {@link #maxNestingDepth()}. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 32;

    public EwkbDecoderConfig {
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must be non-negative");
        }
    }

    /**
     * Returns the default configuration.
     *
     * <ul>
     *   <li>maxNestingDepth: 32</li>
     *   <li>rejectTrailingBytes: false</li>
     * </ul>
     */
    public static EwkbDecoderConfig defaults() {
        return new EwkbDecoderConfig(DEFAULT_MAX_NESTING_DEPTH, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private boolean rejectTrailingBytes = false;

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder withRejectTrailingBytes(boolean rejectTrailingBytes) {
            this.rejectTrailingBytes = rejectTrailingBytes;
            return this;
        }

        public EwkbDecoderConfig build() {
            return new EwkbDecoderConfig(maxNestingDepth, rejectTrailingBytes);
        }
    }
}
