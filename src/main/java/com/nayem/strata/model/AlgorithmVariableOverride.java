package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

/**
 * Replaces per-mode values of one variable of one algorithm for a platform.
 */
public record AlgorithmVariableOverride(String algorithmId, String variableId, List<ModeValue> valuesByMode) {

    public AlgorithmVariableOverride {
        Objects.requireNonNull(algorithmId, "algorithmId");
        Objects.requireNonNull(variableId, "variableId");
        valuesByMode = valuesByMode == null ? List.of() : List.copyOf(valuesByMode);
    }
}
