package com.nayem.strata.model;

import java.util.Objects;

/**
 * An entry of the value-type registry (color, dimension, font family, ...).
 */
public record ValueType(String id, String displayName, String type) implements Identified {

    public ValueType {
        Objects.requireNonNull(id, "id");
    }
}
