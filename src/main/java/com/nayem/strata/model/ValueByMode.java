package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One resolution path of a token: the value that applies when all the listed
 * modes are active. An empty mode list means the token has a single global
 * value.
 * <p>
 * Entries are matched by mode-id <em>set</em>, never by position, so
 * {@code ["light", "compact"]} and {@code ["compact", "light"]} address the
 * same entry.
 * </p>
 *
 * @param modeIds  the modes this value applies to, in document order
 * @param value    the literal or alias value
 * @param metadata optional free-form metadata, {@code null} when absent
 */
public record ValueByMode(List<String> modeIds, TokenValue value, JsonNode metadata) {

    public ValueByMode {
        modeIds = modeIds == null ? List.of() : List.copyOf(modeIds);
        Objects.requireNonNull(value, "value");
    }

    public ValueByMode(List<String> modeIds, TokenValue value) {
        this(modeIds, value, null);
    }

    @JsonIgnore
    public Set<String> modeSet() {
        return Set.copyOf(modeIds);
    }

    public boolean sameModes(ValueByMode other) {
        return modeSet().equals(other.modeSet());
    }

    /**
     * Whether the value or metadata differ from {@code other}; mode order is
     * ignored.
     */
    public boolean differsFrom(ValueByMode other) {
        return !Objects.equals(value, other.value) || !Objects.equals(metadata, other.metadata);
    }
}
