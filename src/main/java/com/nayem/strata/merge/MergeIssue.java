package com.nayem.strata.merge;

import com.nayem.strata.model.SourceKey;
import com.nayem.strata.validation.Problem;

/**
 * A problem found in one source while merging. The merge still completes.
 */
public record MergeIssue(SourceKey source, Problem problem) {
}
