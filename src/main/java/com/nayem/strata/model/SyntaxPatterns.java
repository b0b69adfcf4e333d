package com.nayem.strata.model;

/**
 * How a platform formats token names.
 */
public record SyntaxPatterns(
        String prefix,
        String suffix,
        String delimiter,
        String capitalization,
        String formatString) {

    public static final String DEFAULT_CAPITALIZATION = "none";

    public SyntaxPatterns {
        capitalization = capitalization == null ? DEFAULT_CAPITALIZATION : capitalization;
    }
}
