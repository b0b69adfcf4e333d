package com.nayem.strata.model;

import java.util.Objects;

/**
 * A delivery target of the design system. A platform either carries its own
 * patterns in the core document or points at an extension document through
 * {@link #extensionSource()}.
 */
public record Platform(
        String id,
        String displayName,
        String description,
        SyntaxPatterns syntaxPatterns,
        ValueFormatters valueFormatters,
        ExtensionSource extensionSource) implements Identified {

    public Platform {
        Objects.requireNonNull(id, "id");
    }

    public Platform withPatterns(SyntaxPatterns patterns, ValueFormatters formatters) {
        return new Platform(id, displayName, description, patterns, formatters, extensionSource);
    }
}
