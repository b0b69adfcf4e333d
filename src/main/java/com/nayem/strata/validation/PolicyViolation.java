package com.nayem.strata.validation;

/**
 * A structurally valid request that a business rule disallows, such as a theme
 * overriding a token that is not themeable.
 *
 * @param rule      the name of the rule, e.g. {@code theme.themeable-only}
 * @param subjectId the entity the rule was applied to
 * @param message   a human readable description
 */
public record PolicyViolation(String rule, String subjectId, String message) implements Problem {

    public static final String THEMEABLE_ONLY = "theme.themeable-only";
    public static final String THEME_UNKNOWN_TOKEN = "theme.unknown-token";

    public static PolicyViolation notThemeable(String tokenId) {
        return new PolicyViolation(THEMEABLE_ONLY, tokenId,
                "Token '" + tokenId + "' is not themeable and cannot be overridden by a theme");
    }

    public static PolicyViolation unknownThemeTarget(String tokenId) {
        return new PolicyViolation(THEME_UNKNOWN_TOKEN, tokenId,
                "Theme overrides cannot introduce token '" + tokenId + "'");
    }
}
