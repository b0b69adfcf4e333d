package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record Theme(
        String id,
        String displayName,
        String description,
        @JsonProperty("isDefault") boolean isDefault,
        ExtensionSource overrideSource) implements Identified {

    public Theme {
        Objects.requireNonNull(id, "id");
    }
}
