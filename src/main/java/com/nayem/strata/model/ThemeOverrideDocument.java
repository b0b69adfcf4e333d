package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * A per-theme layer. Only themeable tokens may be targeted.
 */
public record ThemeOverrideDocument(
        String systemId,
        String themeId,
        String figmaFileKey,
        List<ThemeTokenOverride> tokenOverrides) implements SourceDocument {

    public ThemeOverrideDocument {
        Objects.requireNonNull(systemId, "systemId");
        Objects.requireNonNull(themeId, "themeId");
        tokenOverrides = tokenOverrides == null ? List.of() : List.copyOf(tokenOverrides);
    }

    public static ThemeOverrideDocument of(String systemId, String themeId, List<ThemeTokenOverride> overrides) {
        return new ThemeOverrideDocument(systemId, themeId, null, overrides);
    }

    public ThemeOverrideDocument withTokenOverrides(List<ThemeTokenOverride> overrides) {
        return new ThemeOverrideDocument(systemId, themeId, figmaFileKey, overrides);
    }

    @Override
    @JsonIgnore
    public SourceType sourceType() {
        return SourceType.THEME_OVERRIDE;
    }

    @Override
    @JsonIgnore
    public String sourceId() {
        return themeId;
    }
}
