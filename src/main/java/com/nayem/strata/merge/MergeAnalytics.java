package com.nayem.strata.merge;

import com.nayem.strata.model.SourceKey;

import java.util.Map;

/**
 * Counts over one resolved view, recomputed on every merge.
 *
 * @param totalTokens      tokens in the view
 * @param overriddenTokens core tokens changed by at least one layer
 * @param newTokens        tokens introduced by extensions
 * @param omittedTokens    tokens removed by omission
 * @param platformCount    platform extensions layered
 * @param themeCount       0 or 1
 * @param sourceBreakdown  tokens contributed or changed, per source
 */
public record MergeAnalytics(
        int totalTokens,
        int overriddenTokens,
        int newTokens,
        int omittedTokens,
        int platformCount,
        int themeCount,
        Map<SourceKey, Integer> sourceBreakdown) {

    public MergeAnalytics {
        sourceBreakdown = sourceBreakdown == null ? Map.of() : Map.copyOf(sourceBreakdown);
    }
}
