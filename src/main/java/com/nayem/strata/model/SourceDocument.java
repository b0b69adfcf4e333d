package com.nayem.strata.model;

/**
 * A validated document backing one layer of the resolved view.
 */
public sealed interface SourceDocument permits CoreDocument, PlatformExtensionDocument, ThemeOverrideDocument {

    SourceType sourceType();

    String systemId();

    /**
     * The system id for core, otherwise the platform or theme id.
     */
    String sourceId();

    default SourceKey sourceKey() {
        return new SourceKey(sourceType(), sourceId());
    }
}
