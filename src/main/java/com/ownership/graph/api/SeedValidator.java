package com.ownership.graph.api;

import com.ownership.graph.core.model.PropertyId;

/**
 * Rejects malformed crawl requests before any lookup is made.
 */
public final class SeedValidator {

    /** Maximum digits in a tax block. */
    public static final int MAX_BLOCK_DIGITS = 5;

    /** Maximum digits in a tax lot. */
    public static final int MAX_LOT_DIGITS = 4;

    private SeedValidator() {
        // utility class
    }

    /**
     * Validates a seed property and crawl depth.
     *
     * @throws IllegalArgumentException if the seed is null, the borough is not 1 through 5,
     *                                  block or lot is not numeric, or the depth is out of range
     */
    public static void validate(PropertyId seed, int maxDepth, CrawlOptions options) {
        validateSeed(seed);
        validateDepth(maxDepth, options);
    }

    public static void validateSeed(PropertyId seed) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed property must not be null");
        }
        String boroCode = seed.boroCode();
        if (boroCode.length() != 1 || boroCode.charAt(0) < '1' || boroCode.charAt(0) > '5') {
            throw new IllegalArgumentException("Borough code must be a digit from 1 to 5, got: '" + boroCode + "'");
        }
        requireDigits(seed.block(), MAX_BLOCK_DIGITS, "Block");
        requireDigits(seed.lot(), MAX_LOT_DIGITS, "Lot");
    }

    public static void validateDepth(int maxDepth, CrawlOptions options) {
        if (maxDepth < 1 || maxDepth > options.getMaxAllowedDepth()) {
            throw new IllegalArgumentException(
                    "maxDepth must be between 1 and " + options.getMaxAllowedDepth() + " (was " + maxDepth + ")");
        }
    }

    private static void requireDigits(String value, int maxDigits, String field) {
        if (value.isEmpty() || value.length() > maxDigits) {
            throw new IllegalArgumentException(
                    field + " must have 1 to " + maxDigits + " digits, got: '" + value + "'");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException(field + " must be numeric, got: '" + value + "'");
            }
        }
    }
}
