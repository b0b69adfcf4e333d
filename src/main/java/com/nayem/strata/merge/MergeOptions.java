package com.nayem.strata.merge;

/**
 * Restricts a merge to one platform lens.
 *
 * @param targetPlatformId when set, only the extension of this platform is
 *                         layered; {@code null} layers every extension
 * @param includeOmitted   keep tokens that an extension marks {@code omit}
 */
public record MergeOptions(String targetPlatformId, boolean includeOmitted) {

    public static final MergeOptions DEFAULT = new MergeOptions(null, false);

    public static MergeOptions forPlatform(String platformId) {
        return new MergeOptions(platformId, false);
    }

    boolean admits(String platformId) {
        return targetPlatformId == null || targetPlatformId.equals(platformId);
    }
}
