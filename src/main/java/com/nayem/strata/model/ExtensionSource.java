package com.nayem.strata.model;

/**
 * Where a platform extension or theme override document lives.
 */
public record ExtensionSource(String repositoryUri, String filePath) {
}
