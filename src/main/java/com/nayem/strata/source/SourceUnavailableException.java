package com.nayem.strata.source;

import com.nayem.strata.model.SourceKey;

/**
 * A linked source could not be read or written.
 */
public class SourceUnavailableException extends RuntimeException {

    private final SourceKey source;

    public SourceUnavailableException(SourceKey source, String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(SourceKey source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public SourceKey getSource() {
        return source;
    }
}
