package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record TokenCollection(
        String id,
        String name,
        String description,
        List<String> resolvedValueTypeIds,
        @JsonProperty("private") boolean isPrivate,
        List<String> defaultModeIds) implements Identified {

    public TokenCollection {
        Objects.requireNonNull(id, "id");
        resolvedValueTypeIds = resolvedValueTypeIds == null ? List.of() : List.copyOf(resolvedValueTypeIds);
        defaultModeIds = defaultModeIds == null ? List.of() : List.copyOf(defaultModeIds);
    }
}
