package com.nayem.strata.tracking;

import java.time.Instant;

/**
 * @param canExport export is blocked only when local changes have also
 *                  diverged from the remote baseline
 * @param lastSync  when the current baseline was captured, {@code null} if
 *                  there is none
 */
public record ChangeTrackingState(
        boolean hasLocalChanges,
        boolean hasRemoteDivergence,
        boolean canExport,
        int changeCount,
        Instant lastSync) {

    static ChangeTrackingState of(boolean local, boolean divergence, int changeCount, Instant lastSync) {
        return new ChangeTrackingState(local, divergence, !local || !divergence, changeCount, lastSync);
    }
}
