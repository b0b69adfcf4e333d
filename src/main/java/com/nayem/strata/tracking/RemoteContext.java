package com.nayem.strata.tracking;

import java.util.concurrent.CompletableFuture;

/**
 * What the tracker needs to know about the remote side before divergence is
 * meaningful.
 */
public interface RemoteContext {

    RemoteContext DISCONNECTED = new RemoteContext() {
        @Override
        public CompletableFuture<Boolean> isAuthenticated() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public boolean hasSelectedSource() {
            return false;
        }
    };

    CompletableFuture<Boolean> isAuthenticated();

    boolean hasSelectedSource();
}
