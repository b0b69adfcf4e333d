package com.nayem.strata.source;

import java.util.Objects;

/**
 * The repository file backing one source.
 */
public record SourceLocation(String repositoryUri, String branch, String filePath) {

    public SourceLocation {
        Objects.requireNonNull(repositoryUri, "repositoryUri");
        Objects.requireNonNull(filePath, "filePath");
    }

    public SourceLocation withDefaultBranch(String defaultBranch) {
        return branch == null ? new SourceLocation(repositoryUri, defaultBranch, filePath) : this;
    }

    @Override
    public String toString() {
        return repositoryUri + "@" + branch + ":" + filePath;
    }
}
