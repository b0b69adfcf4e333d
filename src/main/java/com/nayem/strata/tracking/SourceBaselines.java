package com.nayem.strata.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.nayem.strata.model.SourceKey;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source baselines, each the JSON tree of a source document as it was
 * loaded. Entries are replaced, never merged.
 */
public class SourceBaselines {

    public record Entry(JsonNode document, Instant capturedAt) {
    }

    private final Map<SourceKey, Entry> entries = new ConcurrentHashMap<>();

    public void put(SourceKey key, JsonNode document) {
        entries.put(key, new Entry(document.deepCopy(), Instant.now()));
    }

    public Optional<Entry> get(SourceKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void remove(SourceKey key) {
        entries.remove(key);
    }

    public boolean contains(SourceKey key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }
}
