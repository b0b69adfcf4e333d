package com.nayem.strata.source;

import com.nayem.strata.model.SourceKey;

import java.time.Instant;

/**
 * The link between a logical source and the file that backs it.
 *
 * @param key        the source
 * @param location   where its document lives
 * @param status     the link state
 * @param error      why the last load failed, {@code null} unless in error
 * @param generation increases with every link or refresh; results of older
 *                   generations are discarded
 * @param updatedAt  when the link last changed state
 */
public record SourceLink(
        SourceKey key,
        SourceLocation location,
        LinkStatus status,
        String error,
        long generation,
        Instant updatedAt) {

    public static SourceLink loading(SourceKey key, SourceLocation location, long generation) {
        return new SourceLink(key, location, LinkStatus.LOADING, null, generation, Instant.now());
    }

    public SourceLink synced() {
        return new SourceLink(key, location, LinkStatus.SYNCED, null, generation, Instant.now());
    }

    public SourceLink failed(String reason) {
        return new SourceLink(key, location, LinkStatus.ERROR, reason, generation, Instant.now());
    }
}
