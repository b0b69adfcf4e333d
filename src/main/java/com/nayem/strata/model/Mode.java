package com.nayem.strata.model;

import java.util.Objects;

public record Mode(String id, String name, String description, String dimensionId) implements Identified {

    public Mode {
        Objects.requireNonNull(id, "id");
    }
}
