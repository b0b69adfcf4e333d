package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

public record Algorithm(String id, String name, String description, List<AlgorithmVariable> variables)
        implements Identified {

    public Algorithm {
        Objects.requireNonNull(id, "id");
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public Algorithm withVariables(List<AlgorithmVariable> replacement) {
        return new Algorithm(id, name, description, replacement);
    }
}
