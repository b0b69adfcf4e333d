package com.nayem.strata.override;

import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.model.SourceType;

import java.util.Objects;

/**
 * The lens a user is editing through.
 *
 * @param sourceType which kind of document receives the edit
 * @param sourceId   the platform or theme id; ignored for core
 * @param systemId   the design system being edited
 * @param version    the version written into platform extension payloads
 */
public record EditContext(SourceType sourceType, String sourceId, String systemId, String version) {

    public EditContext {
        Objects.requireNonNull(sourceType, "sourceType");
        version = version == null ? PlatformExtensionDocument.DEFAULT_VERSION : version;
    }

    public static EditContext core(String systemId) {
        return new EditContext(SourceType.CORE, systemId, systemId, null);
    }

    public static EditContext platform(String systemId, String platformId) {
        return new EditContext(SourceType.PLATFORM_EXTENSION, platformId, systemId, null);
    }

    public static EditContext theme(String systemId, String themeId) {
        return new EditContext(SourceType.THEME_OVERRIDE, themeId, systemId, null);
    }

    boolean hasSourceId() {
        return sourceId != null && !sourceId.isBlank();
    }

    public SourceKey sourceKey() {
        return new SourceKey(sourceType, sourceId);
    }
}
