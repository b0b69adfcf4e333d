package com.nayem.strata.model;

/**
 * Descriptive metadata of a platform extension document.
 */
public record ExtensionMetadata(String name, String description, String maintainer, String lastUpdated) {
}
