package com.nayem.strata.merge;

import com.nayem.strata.model.ModeValue;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.ValueByMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Field-level overlay rules shared by the merge and by override folding.
 * <p>
 * A field present in the overlay replaces the underlying value. Per-mode
 * values are matched by mode-id set: a matching entry is replaced in place,
 * anything else is appended, so no two entries ever share a mode set.
 * </p>
 */
public final class Layering {

    private Layering() {
    }

    public static Token applyOverride(Token base, TokenOverride fragment) {
        return new Token(
                base.id(),
                pick(fragment.displayName(), base.displayName()),
                pick(fragment.description(), base.description()),
                pick(fragment.tokenCollectionId(), base.tokenCollectionId()),
                pick(fragment.resolvedValueTypeId(), base.resolvedValueTypeId()),
                pick(fragment.themeable(), base.themeable()),
                pick(fragment.isPrivate(), base.isPrivate()),
                pick(fragment.status(), base.status()),
                pick(fragment.tokenTier(), base.tokenTier()),
                pick(fragment.generatedByAlgorithm(), base.generatedByAlgorithm()),
                pick(fragment.algorithmId(), base.algorithmId()),
                pick(fragment.taxonomies(), base.taxonomies()),
                pick(fragment.propertyTypes(), base.propertyTypes()),
                pick(fragment.codeSyntax(), base.codeSyntax()),
                fragment.valuesByMode() == null ? base.valuesByMode()
                        : mergeValues(base.valuesByMode(), fragment.valuesByMode()));
    }

    /**
     * Builds a token introduced by an extension. The display name falls back to
     * the id.
     */
    public static Token fromOverride(TokenOverride fragment) {
        return new Token(
                fragment.id(),
                fragment.displayName() == null ? fragment.id() : fragment.displayName(),
                fragment.description(),
                fragment.tokenCollectionId(),
                fragment.resolvedValueTypeId(),
                Boolean.TRUE.equals(fragment.themeable()),
                Boolean.TRUE.equals(fragment.isPrivate()),
                fragment.status(),
                fragment.tokenTier(),
                Boolean.TRUE.equals(fragment.generatedByAlgorithm()),
                fragment.algorithmId(),
                fragment.taxonomies(),
                fragment.propertyTypes(),
                fragment.codeSyntax(),
                fragment.valuesByMode());
    }

    /**
     * Overlays {@code later} onto {@code earlier}; both describe the same token.
     */
    public static TokenOverride mergeFragments(TokenOverride earlier, TokenOverride later) {
        if (!earlier.id().equals(later.id())) {
            throw new IllegalArgumentException("Cannot merge fragments of " + earlier.id() + " and " + later.id());
        }
        List<ValueByMode> values = earlier.valuesByMode() == null ? later.valuesByMode()
                : later.valuesByMode() == null ? earlier.valuesByMode()
                : mergeValues(earlier.valuesByMode(), later.valuesByMode());
        return new TokenOverride(
                earlier.id(),
                pick(later.displayName(), earlier.displayName()),
                pick(later.description(), earlier.description()),
                pick(later.tokenCollectionId(), earlier.tokenCollectionId()),
                pick(later.resolvedValueTypeId(), earlier.resolvedValueTypeId()),
                pick(later.themeable(), earlier.themeable()),
                pick(later.isPrivate(), earlier.isPrivate()),
                pick(later.status(), earlier.status()),
                pick(later.tokenTier(), earlier.tokenTier()),
                pick(later.generatedByAlgorithm(), earlier.generatedByAlgorithm()),
                pick(later.algorithmId(), earlier.algorithmId()),
                pick(later.taxonomies(), earlier.taxonomies()),
                pick(later.propertyTypes(), earlier.propertyTypes()),
                pick(later.codeSyntax(), earlier.codeSyntax()),
                values,
                pick(later.omit(), earlier.omit()));
    }

    public static List<ValueByMode> mergeValues(List<ValueByMode> base, List<ValueByMode> incoming) {
        List<ValueByMode> merged = new ArrayList<>(base);
        for (ValueByMode entry : incoming) {
            int match = indexOf(merged, entry.modeSet());
            if (match >= 0) {
                // same value under a reordered mode list is not a change
                if (entry.differsFrom(merged.get(match))) {
                    merged.set(match, entry);
                }
            } else {
                merged.add(entry);
            }
        }
        return merged;
    }

    public static List<ModeValue> mergeModeValues(List<ModeValue> base, List<ModeValue> incoming) {
        List<ModeValue> merged = new ArrayList<>(base);
        for (ModeValue entry : incoming) {
            Set<String> modes = entry.modeSet();
            int match = -1;
            for (int i = 0; i < merged.size(); i++) {
                if (merged.get(i).modeSet().equals(modes)) {
                    match = i;
                    break;
                }
            }
            if (match >= 0) {
                merged.set(match, entry);
            } else {
                merged.add(entry);
            }
        }
        return merged;
    }

    /**
     * Drops every entry that references one of {@code omittedModes}.
     */
    public static List<ValueByMode> withoutModes(List<ValueByMode> values, Set<String> omittedModes) {
        return values.stream()
                .filter(entry -> entry.modeIds().stream().noneMatch(omittedModes::contains))
                .toList();
    }

    private static int indexOf(List<ValueByMode> values, Set<String> modes) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).modeSet().equals(modes)) {
                return i;
            }
        }
        return -1;
    }

    private static <T> T pick(T overlay, T base) {
        return overlay != null ? overlay : base;
    }

    private static boolean pick(Boolean overlay, boolean base) {
        return overlay != null ? overlay : base;
    }
}
