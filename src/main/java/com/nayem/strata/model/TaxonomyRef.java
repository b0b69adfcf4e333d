package com.nayem.strata.model;

/**
 * Classification of a token by one term of one taxonomy.
 */
public record TaxonomyRef(String taxonomyId, String termId) {
}
