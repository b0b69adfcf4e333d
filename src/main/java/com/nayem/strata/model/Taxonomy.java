package com.nayem.strata.model;

import java.util.List;
import java.util.Objects;

public record Taxonomy(String id, String name, String description, List<TaxonomyTerm> terms) implements Identified {

    public Taxonomy {
        Objects.requireNonNull(id, "id");
        terms = terms == null ? List.of() : List.copyOf(terms);
    }
}
