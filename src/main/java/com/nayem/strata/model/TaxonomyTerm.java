package com.nayem.strata.model;

public record TaxonomyTerm(String id, String name, String description) {
}
