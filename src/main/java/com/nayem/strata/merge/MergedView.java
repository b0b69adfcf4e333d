package com.nayem.strata.merge;

import com.nayem.strata.model.Algorithm;
import com.nayem.strata.model.Dimension;
import com.nayem.strata.model.Mode;
import com.nayem.strata.model.Platform;
import com.nayem.strata.model.Taxonomy;
import com.nayem.strata.model.Theme;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenCollection;
import com.nayem.strata.model.ValueType;

import java.util.List;
import java.util.Map;

/**
 * The final token set after layering every source, together with the
 * entities that frame it.
 */
public record MergedView(
        List<Token> tokens,
        List<TokenCollection> tokenCollections,
        List<Dimension> dimensions,
        List<Platform> platforms,
        List<Theme> themes,
        List<Taxonomy> taxonomies,
        List<Algorithm> algorithms,
        List<ValueType> valueTypes,
        List<String> taxonomyOrder,
        List<String> dimensionOrder,
        Map<String, TokenProvenance> provenance) {

    public MergedView {
        tokens = List.copyOf(tokens);
        tokenCollections = List.copyOf(tokenCollections);
        dimensions = List.copyOf(dimensions);
        platforms = List.copyOf(platforms);
        themes = List.copyOf(themes);
        taxonomies = List.copyOf(taxonomies);
        algorithms = List.copyOf(algorithms);
        valueTypes = List.copyOf(valueTypes);
        taxonomyOrder = List.copyOf(taxonomyOrder);
        dimensionOrder = List.copyOf(dimensionOrder);
        provenance = Map.copyOf(provenance);
    }

    public List<Mode> modes() {
        return dimensions.stream().flatMap(dimension -> dimension.modes().stream()).toList();
    }

    public Token token(String tokenId) {
        return tokens.stream().filter(token -> token.id().equals(tokenId)).findFirst().orElse(null);
    }
}
