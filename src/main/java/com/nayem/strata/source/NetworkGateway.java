package com.nayem.strata.source;

import java.util.concurrent.CompletableFuture;

/**
 * Reads and writes files of remote repositories. Only the source manager calls
 * it.
 */
public interface NetworkGateway {

    CompletableFuture<RemoteFile> fetchFile(String repositoryUri, String filePath, String branch);

    CompletableFuture<Void> writeFile(String repositoryUri, String filePath, String branch, String content,
            String message);

    default CompletableFuture<Boolean> isAuthenticated() {
        return CompletableFuture.completedFuture(true);
    }
}
