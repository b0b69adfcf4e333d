package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

/**
 * An input of a token-generating algorithm, optionally varying by mode.
 */
public record AlgorithmVariable(String id, String name, String type, List<ModeValue> valuesByMode) {

    public AlgorithmVariable {
        Objects.requireNonNull(id, "id");
        valuesByMode = valuesByMode == null ? List.of() : List.copyOf(valuesByMode);
    }

    public AlgorithmVariable withValuesByMode(List<ModeValue> values) {
        return new AlgorithmVariable(id, name, type, values);
    }
}
