package com.nayem.strata.source;

/**
 * The content of a file fetched from a repository.
 *
 * @param content  the raw file content
 * @param revision the revision the content was read at, if the gateway knows it
 */
public record RemoteFile(String content, String revision) {

    public static RemoteFile of(String content) {
        return new RemoteFile(content, null);
    }
}
