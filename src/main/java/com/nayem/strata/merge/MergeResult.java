package com.nayem.strata.merge;

import com.nayem.strata.model.SourceKey;
import com.nayem.strata.validation.PolicyViolation;

import java.util.List;
import java.util.Set;

/**
 * @param resolved         the resolved view
 * @param analytics        counts over {@code resolved}
 * @param issues           every problem found, in merge order
 * @param excludedSources  layers left out entirely because they were invalid
 */
public record MergeResult(
        MergedView resolved,
        MergeAnalytics analytics,
        List<MergeIssue> issues,
        Set<SourceKey> excludedSources) {

    public MergeResult {
        issues = List.copyOf(issues);
        excludedSources = Set.copyOf(excludedSources);
    }

    public List<PolicyViolation> policyViolations() {
        return issues.stream()
                .filter(issue -> issue.problem() instanceof PolicyViolation)
                .map(issue -> (PolicyViolation) issue.problem())
                .toList();
    }
}
