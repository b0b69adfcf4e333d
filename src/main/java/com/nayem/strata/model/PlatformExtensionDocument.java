package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * A per-platform layer: token overrides and additions, omitted modes and
 * dimensions, and the platform's own naming and value formatting.
 */
public record PlatformExtensionDocument(
        String systemId,
        String platformId,
        String version,
        String figmaFileKey,
        ExtensionMetadata metadata,
        SyntaxPatterns syntaxPatterns,
        ValueFormatters valueFormatters,
        List<AlgorithmVariableOverride> algorithmVariableOverrides,
        List<TokenOverride> tokenOverrides,
        List<String> omittedModes,
        List<String> omittedDimensions) implements SourceDocument {

    public static final String DEFAULT_VERSION = "1.0.0";

    public PlatformExtensionDocument {
        Objects.requireNonNull(systemId, "systemId");
        Objects.requireNonNull(platformId, "platformId");
        version = version == null ? DEFAULT_VERSION : version;
        algorithmVariableOverrides = algorithmVariableOverrides == null
                ? List.of() : List.copyOf(algorithmVariableOverrides);
        tokenOverrides = tokenOverrides == null ? List.of() : List.copyOf(tokenOverrides);
        omittedModes = omittedModes == null ? List.of() : List.copyOf(omittedModes);
        omittedDimensions = omittedDimensions == null ? List.of() : List.copyOf(omittedDimensions);
    }

    /**
     * A minimal extension carrying only token overrides.
     */
    public static PlatformExtensionDocument of(String systemId, String platformId, List<TokenOverride> overrides) {
        return new PlatformExtensionDocument(systemId, platformId, DEFAULT_VERSION, null, null, null, null,
                null, overrides, null, null);
    }

    public PlatformExtensionDocument withTokenOverrides(List<TokenOverride> overrides) {
        return new PlatformExtensionDocument(systemId, platformId, version, figmaFileKey, metadata, syntaxPatterns,
                valueFormatters, algorithmVariableOverrides, overrides, omittedModes, omittedDimensions);
    }

    public PlatformExtensionDocument withOmissions(List<String> modes, List<String> dimensions) {
        return new PlatformExtensionDocument(systemId, platformId, version, figmaFileKey, metadata, syntaxPatterns,
                valueFormatters, algorithmVariableOverrides, tokenOverrides, modes, dimensions);
    }

    @Override
    @JsonIgnore
    public SourceType sourceType() {
        return SourceType.PLATFORM_EXTENSION;
    }

    @Override
    @JsonIgnore
    public String sourceId() {
        return platformId;
    }

    @JsonIgnore
    public boolean hasFormatting() {
        return syntaxPatterns != null || valueFormatters != null;
    }
}
