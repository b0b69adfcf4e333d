package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * The canonical token system of record. Replaced wholesale on reload.
 */
public record CoreDocument(
        String systemId,
        String systemName,
        String version,
        List<Token> tokens,
        List<TokenCollection> tokenCollections,
        List<Dimension> dimensions,
        List<Platform> platforms,
        List<Theme> themes,
        List<Taxonomy> taxonomies,
        List<Algorithm> algorithms,
        List<ValueType> resolvedValueTypes,
        NamingRules namingRules,
        List<String> dimensionOrder) implements SourceDocument {

    public CoreDocument {
        Objects.requireNonNull(systemId, "systemId");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        tokenCollections = tokenCollections == null ? List.of() : List.copyOf(tokenCollections);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        themes = themes == null ? List.of() : List.copyOf(themes);
        taxonomies = taxonomies == null ? List.of() : List.copyOf(taxonomies);
        algorithms = algorithms == null ? List.of() : List.copyOf(algorithms);
        resolvedValueTypes = resolvedValueTypes == null ? List.of() : List.copyOf(resolvedValueTypes);
        namingRules = namingRules == null ? NamingRules.empty() : namingRules;
        dimensionOrder = dimensionOrder == null ? List.of() : List.copyOf(dimensionOrder);
    }

    @Override
    @JsonIgnore
    public SourceType sourceType() {
        return SourceType.CORE;
    }

    @Override
    @JsonIgnore
    public String sourceId() {
        return systemId;
    }

    public Token token(String tokenId) {
        return tokens.stream().filter(token -> token.id().equals(tokenId)).findFirst().orElse(null);
    }

    public Platform platform(String platformId) {
        return platforms.stream().filter(p -> p.id().equals(platformId)).findFirst().orElse(null);
    }

    public Theme theme(String themeId) {
        return themes.stream().filter(t -> t.id().equals(themeId)).findFirst().orElse(null);
    }

    public Dimension dimension(String dimensionId) {
        return dimensions.stream().filter(d -> d.id().equals(dimensionId)).findFirst().orElse(null);
    }

    /**
     * All modes of all dimensions, in dimension order.
     */
    public List<Mode> modes() {
        return dimensions.stream().flatMap(dimension -> dimension.modes().stream()).toList();
    }

    public boolean hasMode(String modeId) {
        return dimensions.stream().anyMatch(dimension -> dimension.hasMode(modeId));
    }
}
