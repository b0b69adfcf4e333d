package com.nayem.strata.store;

import com.fasterxml.jackson.core.type.TypeReference;
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

/**
 * A named, typed collection of the document store.
 *
 * @param <E> the element type
 */
public final class StoreCollection<E> {

    public static final StoreCollection<Token> TOKENS =
            new StoreCollection<>("tokens", true, new TypeReference<>() { });
    public static final StoreCollection<TokenCollection> COLLECTIONS =
            new StoreCollection<>("collections", true, new TypeReference<>() { });
    public static final StoreCollection<Mode> MODES =
            new StoreCollection<>("modes", false, new TypeReference<>() { });
    public static final StoreCollection<Dimension> DIMENSIONS =
            new StoreCollection<>("dimensions", true, new TypeReference<>() { });
    public static final StoreCollection<Platform> PLATFORMS =
            new StoreCollection<>("platforms", true, new TypeReference<>() { });
    public static final StoreCollection<Theme> THEMES =
            new StoreCollection<>("themes", true, new TypeReference<>() { });
    public static final StoreCollection<Taxonomy> TAXONOMIES =
            new StoreCollection<>("taxonomies", true, new TypeReference<>() { });
    public static final StoreCollection<Algorithm> ALGORITHMS =
            new StoreCollection<>("algorithms", true, new TypeReference<>() { });
    public static final StoreCollection<ValueType> VALUE_TYPES =
            new StoreCollection<>("valueTypes", true, new TypeReference<>() { });
    public static final StoreCollection<String> TAXONOMY_ORDER =
            new StoreCollection<>("taxonomyOrder", false, new TypeReference<>() { });
    public static final StoreCollection<String> DIMENSION_ORDER =
            new StoreCollection<>("dimensionOrder", false, new TypeReference<>() { });

    /**
     * Every collection, in publish order.
     */
    public static final List<StoreCollection<?>> ALL = List.of(TOKENS, COLLECTIONS, MODES, DIMENSIONS, PLATFORMS,
            THEMES, TAXONOMIES, ALGORITHMS, VALUE_TYPES, TAXONOMY_ORDER, DIMENSION_ORDER);

    /**
     * The entity collections compared id-by-id by change tracking.
     */
    public static final List<StoreCollection<?>> TRACKED = ALL.stream()
            .filter(StoreCollection::tracked)
            .toList();

    private final String name;
    private final boolean tracked;
    private final TypeReference<List<E>> listType;

    private StoreCollection(String name, boolean tracked, TypeReference<List<E>> listType) {
        this.name = name;
        this.tracked = tracked;
        this.listType = listType;
    }

    public String name() {
        return name;
    }

    public boolean tracked() {
        return tracked;
    }

    TypeReference<List<E>> listType() {
        return listType;
    }

    public static StoreCollection<?> named(String name) {
        return ALL.stream()
                .filter(collection -> collection.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + name));
    }

    @Override
    public String toString() {
        return name;
    }
}
