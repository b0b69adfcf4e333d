package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

/**
 * A per-theme value substitution for one token. Theme overrides key tokens by
 * {@code tokenId}, unlike platform extensions which use {@code id}.
 */
public record ThemeTokenOverride(String tokenId, List<ValueByMode> valuesByMode) {

    public ThemeTokenOverride {
        Objects.requireNonNull(tokenId, "tokenId");
        valuesByMode = valuesByMode == null ? List.of() : List.copyOf(valuesByMode);
    }
}
