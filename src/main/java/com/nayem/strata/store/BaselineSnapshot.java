package com.nayem.strata.store;

import java.time.Instant;
import java.util.Objects;

/**
 * The data captured when a document set was freshly loaded. Used only as the
 * left-hand side of diffs; replaced, never merged.
 */
public record BaselineSnapshot(DataSnapshot data, Instant capturedAt) {

    public BaselineSnapshot {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(capturedAt, "capturedAt");
    }

    public static BaselineSnapshot of(DataSnapshot data) {
        return new BaselineSnapshot(data, Instant.now());
    }
}
