package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kinds of document that can back a layer of the resolved view.
 * <p>
 * Code that dispatches on a source type should use a {@code switch} expression
 * without a {@code default} branch so a new kind fails compilation instead of
 * falling through silently.
 * </p>
 */
public enum SourceType {

    /**
     * The canonical token system of record.
     */
    CORE("core"),

    /**
     * A per-platform override and addition layer.
     */
    PLATFORM_EXTENSION("platform-extension"),

    /**
     * A per-theme value substitution layer, restricted to themeable tokens.
     */
    THEME_OVERRIDE("theme-override");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SourceType fromWireName(String value) {
        for (SourceType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
