package com.nayem.strata.tracking;

import java.util.List;

/**
 * Keys added, modified and removed between a baseline and the current state.
 */
public record ChangeSet(List<String> added, List<String> modified, List<String> removed, int totalChanges) {

    public static final ChangeSet EMPTY = new ChangeSet(List.of(), List.of(), List.of(), 0);

    public ChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        removed = List.copyOf(removed);
    }

    public static ChangeSet of(List<String> added, List<String> modified, List<String> removed) {
        return new ChangeSet(added, modified, removed, added.size() + modified.size() + removed.size());
    }

    public boolean isEmpty() {
        return totalChanges == 0;
    }
}
