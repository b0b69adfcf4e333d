package com.nayem.strata.source;

import com.nayem.strata.merge.MergeEngine.Candidate;
import com.nayem.strata.merge.MergeOptions;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.model.SourceType;
import com.nayem.strata.model.Theme;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.validation.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The validation outcome of every linked source plus the active lens. Only the
 * merge worker mutates it.
 */
public class LayerState {

    private final Map<SourceKey, ValidationResult<? extends SourceDocument>> layers = new LinkedHashMap<>();
    private String platformId;
    private String themeId;

    synchronized void put(SourceKey key, ValidationResult<? extends SourceDocument> result) {
        layers.put(key, result);
    }

    synchronized boolean remove(SourceKey key) {
        return layers.remove(key) != null;
    }

    synchronized void lens(String platformId, String themeId) {
        this.platformId = platformId;
        this.themeId = themeId;
    }

    public synchronized String platformId() {
        return platformId;
    }

    public synchronized String themeId() {
        return themeId;
    }

    public synchronized Optional<SourceDocument> document(SourceKey key) {
        ValidationResult<? extends SourceDocument> result = layers.get(key);
        return result == null || !result.isValid() ? Optional.empty() : Optional.of(result.value());
    }

    /**
     * The first valid core layer. The merge needs exactly one.
     */
    public synchronized Optional<CoreDocument> core() {
        return layers.entrySet().stream()
                .filter(entry -> entry.getKey().type() == SourceType.CORE && entry.getValue().isValid())
                .map(entry -> (CoreDocument) entry.getValue().value())
                .findFirst();
    }

    /**
     * Every platform extension in link order, invalid ones included so the
     * merge can report them.
     */
    @SuppressWarnings("unchecked")
    public synchronized List<Candidate<PlatformExtensionDocument>> extensionCandidates() {
        List<Candidate<PlatformExtensionDocument>> candidates = new ArrayList<>();
        layers.forEach((key, result) -> {
            if (key.type() == SourceType.PLATFORM_EXTENSION) {
                candidates.add(new Candidate<>(key, (ValidationResult<PlatformExtensionDocument>) result));
            }
        });
        return candidates;
    }

    /**
     * The theme override to apply: the one the lens names, otherwise the one
     * for the core's default theme. {@code null} when neither is linked.
     */
    @SuppressWarnings("unchecked")
    public synchronized Candidate<ThemeOverrideDocument> themeCandidate() {
        String selected = themeId != null ? themeId : core()
                .flatMap(core -> core.themes().stream().filter(Theme::isDefault).findFirst())
                .map(Theme::id)
                .orElse(null);
        if (selected == null) {
            return null;
        }
        SourceKey key = SourceKey.theme(selected);
        ValidationResult<? extends SourceDocument> result = layers.get(key);
        return result == null ? null : new Candidate<>(key, (ValidationResult<ThemeOverrideDocument>) result);
    }

    public synchronized MergeOptions mergeOptions() {
        return platformId == null ? MergeOptions.DEFAULT : MergeOptions.forPlatform(platformId);
    }

    public synchronized int size() {
        return layers.size();
    }
}
