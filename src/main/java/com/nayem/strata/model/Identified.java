package com.nayem.strata.model;

/**
 * An entity with a stable id, used as the key when diffing collections.
 */
public interface Identified {
    String id();
}
