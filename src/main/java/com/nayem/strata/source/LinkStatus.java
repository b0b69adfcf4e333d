package com.nayem.strata.source;

/**
 * The state of a source link: {@code LOADING -> SYNCED | ERROR}, back to
 * {@code LOADING} on refresh.
 */
public enum LinkStatus {

    /**
     * A fetch is in flight.
     */
    LOADING,

    /**
     * The latest content was validated and merged.
     */
    SYNCED,

    /**
     * The latest fetch, validation or reference check failed.
     */
    ERROR
}
