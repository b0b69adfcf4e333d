package com.nayem.strata.model;

import java.util.Objects;

/**
 * Identifies one logical source: the core document, one platform extension or
 * one theme override.
 *
 * @param type     the kind of document
 * @param sourceId the system id for core, otherwise the platform or theme id
 */
public record SourceKey(SourceType type, String sourceId) {

    public SourceKey {
        Objects.requireNonNull(type, "type");
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required for " + type.wireName());
        }
    }

    public static SourceKey core(String systemId) {
        return new SourceKey(SourceType.CORE, systemId);
    }

    public static SourceKey platform(String platformId) {
        return new SourceKey(SourceType.PLATFORM_EXTENSION, platformId);
    }

    public static SourceKey theme(String themeId) {
        return new SourceKey(SourceType.THEME_OVERRIDE, themeId);
    }

    @Override
    public String toString() {
        return type.wireName() + ":" + sourceId;
    }
}
