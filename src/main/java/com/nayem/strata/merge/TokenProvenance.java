package com.nayem.strata.merge;

import com.nayem.strata.model.SourceKey;

/**
 * Where a resolved token came from.
 *
 * @param origin     the source that introduced the token
 * @param lastWriter the source that last changed it
 */
public record TokenProvenance(SourceKey origin, SourceKey lastWriter) {

    TokenProvenance writtenBy(SourceKey source) {
        return new TokenProvenance(origin, source);
    }
}
