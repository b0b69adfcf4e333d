package com.nayem.strata.override;

import com.nayem.strata.tracking.PendingChanges;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active override session and the staged configuration count, and
 * reports both to change tracking.
 */
public class OverrideTracker implements PendingChanges {

    private final OverrideSynthesizer synthesizer;
    private final AtomicReference<OverrideSession> session = new AtomicReference<>();
    private final AtomicInteger stagedConfiguration = new AtomicInteger();

    public OverrideTracker(OverrideSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Starts editing through {@code context}, discarding any pending edits of
     * the previous lens.
     */
    public OverrideSession begin(EditContext context) {
        OverrideSession next = new OverrideSession(context, synthesizer);
        session.set(next);
        return next;
    }

    public Optional<OverrideSession> current() {
        return Optional.ofNullable(session.get());
    }

    public void end() {
        session.set(null);
    }

    public void stageConfigurationChange() {
        stagedConfiguration.incrementAndGet();
    }

    public void clearStagedConfiguration() {
        stagedConfiguration.set(0);
    }

    @Override
    public int pendingOverrideCount() {
        OverrideSession active = session.get();
        return active == null ? 0 : active.pendingCount();
    }

    @Override
    public int stagedConfigurationCount() {
        return stagedConfiguration.get();
    }
}
