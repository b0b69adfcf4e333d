package com.nayem.strata.model;

/**
 * The formatted name of a token on one platform.
 */
public record CodeSyntax(String platformId, String formattedName) {
}
