package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

/**
 * An axis of variation (color scheme, density, ...) owning an ordered list of
 * modes.
 */
public record Dimension(
        String id,
        String displayName,
        String description,
        List<Mode> modes,
        boolean required,
        String defaultMode) implements Identified {

    public Dimension {
        Objects.requireNonNull(id, "id");
        modes = modes == null ? List.of() : List.copyOf(modes);
    }

    public boolean hasMode(String modeId) {
        return modes.stream().anyMatch(mode -> mode.id().equals(modeId));
    }
}
