package com.nayem.strata.tracking;

/**
 * Edits that exist only in memory and are reported to the tracker by their
 * owners: override changes not yet folded into a source document, and staged
 * configuration changes.
 */
public interface PendingChanges {

    PendingChanges NONE = of(0, 0);

    int pendingOverrideCount();

    int stagedConfigurationCount();

    default boolean hasPending() {
        return pendingOverrideCount() > 0 || stagedConfigurationCount() > 0;
    }

    static PendingChanges of(int overrides, int configuration) {
        if (overrides < 0 || configuration < 0) {
            throw new IllegalArgumentException("Pending counts must not be negative");
        }
        return new PendingChanges() {
            @Override
            public int pendingOverrideCount() {
                return overrides;
            }

            @Override
            public int stagedConfigurationCount() {
                return configuration;
            }
        };
    }
}
