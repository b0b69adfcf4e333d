package com.nayem.strata.override;

import com.nayem.strata.model.SourceType;
import com.nayem.strata.model.Token;

import java.time.Instant;

/**
 * An edit recorded in memory before it is folded into a source document.
 *
 * @param originalValue the token before the session's first edit of it,
 *                      {@code null} for a new token
 */
public record OverrideChange(
        String tokenId,
        Token originalValue,
        Token newValue,
        SourceType sourceType,
        String sourceId,
        Instant timestamp) {
}
