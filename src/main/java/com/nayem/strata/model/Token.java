package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A design token of the core document, or of the resolved view after layering.
 * <p>
 * No two {@link #valuesByMode()} entries may share an identical mode-id set.
 * </p>
 */
public record Token(
        String id,
        String displayName,
        String description,
        String tokenCollectionId,
        String resolvedValueTypeId,
        boolean themeable,
        @JsonProperty("private") boolean isPrivate,
        String status,
        String tokenTier,
        boolean generatedByAlgorithm,
        String algorithmId,
        List<TaxonomyRef> taxonomies,
        List<String> propertyTypes,
        List<CodeSyntax> codeSyntax,
        List<ValueByMode> valuesByMode) implements Identified {

    public Token {
        Objects.requireNonNull(id, "id");
        taxonomies = taxonomies == null ? List.of() : List.copyOf(taxonomies);
        propertyTypes = propertyTypes == null ? List.of() : List.copyOf(propertyTypes);
        codeSyntax = codeSyntax == null ? List.of() : List.copyOf(codeSyntax);
        valuesByMode = valuesByMode == null ? List.of() : List.copyOf(valuesByMode);
    }

    /**
     * Returns the entry whose mode set equals {@code modeIds}, if any.
     */
    public ValueByMode valueFor(Set<String> modeIds) {
        for (ValueByMode entry : valuesByMode) {
            if (entry.modeSet().equals(modeIds)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Whether two entries resolve the same mode set.
     */
    public boolean hasDuplicateModeSets() {
        Set<Set<String>> seen = new HashSet<>();
        for (ValueByMode entry : valuesByMode) {
            if (!seen.add(entry.modeSet())) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .displayName(displayName)
                .description(description)
                .tokenCollectionId(tokenCollectionId)
                .resolvedValueTypeId(resolvedValueTypeId)
                .themeable(themeable)
                .isPrivate(isPrivate)
                .status(status)
                .tokenTier(tokenTier)
                .generatedByAlgorithm(generatedByAlgorithm)
                .algorithmId(algorithmId)
                .taxonomies(taxonomies)
                .propertyTypes(propertyTypes)
                .codeSyntax(codeSyntax)
                .valuesByMode(valuesByMode);
    }

    public static class Builder {
        private final String id;
        private String displayName;
        private String description;
        private String tokenCollectionId;
        private String resolvedValueTypeId;
        private boolean themeable;
        private boolean isPrivate;
        private String status;
        private String tokenTier;
        private boolean generatedByAlgorithm;
        private String algorithmId;
        private List<TaxonomyRef> taxonomies = List.of();
        private List<String> propertyTypes = List.of();
        private List<CodeSyntax> codeSyntax = List.of();
        private List<ValueByMode> valuesByMode = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
            this.displayName = id;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tokenCollectionId(String tokenCollectionId) {
            this.tokenCollectionId = tokenCollectionId;
            return this;
        }

        public Builder resolvedValueTypeId(String resolvedValueTypeId) {
            this.resolvedValueTypeId = resolvedValueTypeId;
            return this;
        }

        public Builder themeable(boolean themeable) {
            this.themeable = themeable;
            return this;
        }

        public Builder isPrivate(boolean isPrivate) {
            this.isPrivate = isPrivate;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder tokenTier(String tokenTier) {
            this.tokenTier = tokenTier;
            return this;
        }

        public Builder generatedByAlgorithm(boolean generatedByAlgorithm) {
            this.generatedByAlgorithm = generatedByAlgorithm;
            return this;
        }

        public Builder algorithmId(String algorithmId) {
            this.algorithmId = algorithmId;
            return this;
        }

        public Builder taxonomies(List<TaxonomyRef> taxonomies) {
            this.taxonomies = taxonomies;
            return this;
        }

        public Builder propertyTypes(List<String> propertyTypes) {
            this.propertyTypes = propertyTypes;
            return this;
        }

        public Builder codeSyntax(List<CodeSyntax> codeSyntax) {
            this.codeSyntax = codeSyntax;
            return this;
        }

        public Builder valuesByMode(List<ValueByMode> valuesByMode) {
            this.valuesByMode = new ArrayList<>(valuesByMode);
            return this;
        }

        public Builder value(List<String> modeIds, TokenValue value) {
            this.valuesByMode.add(new ValueByMode(modeIds, value));
            return this;
        }

        public Token build() {
            return new Token(id, displayName, description, tokenCollectionId, resolvedValueTypeId, themeable,
                    isPrivate, status, tokenTier, generatedByAlgorithm, algorithmId, taxonomies, propertyTypes,
                    codeSyntax, valuesByMode);
        }
    }
}
