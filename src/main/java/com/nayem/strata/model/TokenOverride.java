package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A partial token carried by a platform extension, keyed by {@code id}.
 * <p>
 * Every field other than {@code id} is optional: {@code null} means "not
 * present in the fragment" and leaves the underlying value untouched. Lists
 * are therefore never defaulted to empty here.
 * </p>
 */
public record TokenOverride(
        String id,
        String displayName,
        String description,
        String tokenCollectionId,
        String resolvedValueTypeId,
        Boolean themeable,
        @JsonProperty("private") Boolean isPrivate,
        String status,
        String tokenTier,
        Boolean generatedByAlgorithm,
        String algorithmId,
        List<TaxonomyRef> taxonomies,
        List<String> propertyTypes,
        List<CodeSyntax> codeSyntax,
        List<ValueByMode> valuesByMode,
        Boolean omit) {

    public TokenOverride {
        Objects.requireNonNull(id, "id");
        taxonomies = taxonomies == null ? null : List.copyOf(taxonomies);
        propertyTypes = propertyTypes == null ? null : List.copyOf(propertyTypes);
        codeSyntax = codeSyntax == null ? null : List.copyOf(codeSyntax);
        valuesByMode = valuesByMode == null ? null : List.copyOf(valuesByMode);
    }

    public static TokenOverride values(String id, List<ValueByMode> valuesByMode) {
        return new TokenOverride(id, null, null, null, null, null, null, null, null, null, null,
                null, null, null, valuesByMode, null);
    }

    public static TokenOverride omitted(String id) {
        return new TokenOverride(id, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, Boolean.TRUE);
    }

    @JsonIgnore
    public boolean isOmitted() {
        return Boolean.TRUE.equals(omit);
    }
}
