package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Set;

/**
 * A raw per-mode value of an algorithm variable.
 */
public record ModeValue(List<String> modeIds, JsonNode value) {

    public ModeValue {
        modeIds = modeIds == null ? List.of() : List.copyOf(modeIds);
        value = value == null ? NullNode.getInstance() : value;
    }

    @JsonIgnore
    public Set<String> modeSet() {
        return Set.copyOf(modeIds);
    }
}
