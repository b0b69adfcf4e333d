package com.nayem.strata.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.strata.model.Algorithm;
import com.nayem.strata.model.AlgorithmVariable;
import com.nayem.strata.model.AlgorithmVariableOverride;
import com.nayem.strata.model.CodeSyntax;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.Dimension;
import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.model.ExtensionMetadata;
import com.nayem.strata.model.ExtensionSource;
import com.nayem.strata.model.Identified;
import com.nayem.strata.model.Mode;
import com.nayem.strata.model.ModeValue;
import com.nayem.strata.model.NamingRules;
import com.nayem.strata.model.Platform;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.SourceType;
import com.nayem.strata.model.SyntaxPatterns;
import com.nayem.strata.model.Taxonomy;
import com.nayem.strata.model.TaxonomyRef;
import com.nayem.strata.model.TaxonomyTerm;
import com.nayem.strata.model.Theme;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenCollection;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.TokenValue;
import com.nayem.strata.model.ValueByMode;
import com.nayem.strata.model.ValueFormatters;
import com.nayem.strata.model.ValueType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.nayem.strata.validation.FieldReader.index;
import static com.nayem.strata.validation.FieldReader.path;

/**
 * Reads raw core, platform-extension and theme-override documents into their
 * typed form.
 * <p>
 * Every problem found is reported, so a caller can show all of them at once.
 * Optional fields are normalized: absent booleans read as {@code false}, absent
 * lists as empty, an absent {@code syntaxPatterns.capitalization} as
 * {@code "none"} and an absent extension {@code version} as {@code "1.0.0"}.
 * Fragments inside {@code tokenOverrides} are the exception: absent fields stay
 * absent so that merging leaves the underlying value untouched.
 * </p>
 * <p>
 * Instances hold no state beyond the parser and may be shared.
 * </p>
 */
public class SchemaValidator {

    interface Codes {
        String MALFORMED = "document.malformed";
        String NOT_OBJECT = "document.not_object";
        String REQUIRED = "field.required";
        String TYPE = "field.type";
        String DUPLICATE_ID = "entity.duplicate";
        String DUPLICATE_MODES = "token.values.duplicate_modes";
        String VALUE_INVALID = "token.value.invalid";
        String VALUE_TYPE_REQUIRED = "token.value_type.required";
    }

    private final ObjectMapper objectMapper;

    public SchemaValidator() {
        this(DocumentCodec.defaultMapper());
    }

    public SchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validates a document of the given kind.
     */
    public ValidationResult<? extends SourceDocument> validate(SourceType type, String raw) {
        return switch (type) {
            case CORE -> validateCore(raw);
            case PLATFORM_EXTENSION -> validatePlatformExtension(raw);
            case THEME_OVERRIDE -> validateThemeOverride(raw);
        };
    }

    public ValidationResult<? extends SourceDocument> validate(SourceType type, JsonNode raw) {
        return switch (type) {
            case CORE -> validateCore(raw);
            case PLATFORM_EXTENSION -> validatePlatformExtension(raw);
            case THEME_OVERRIDE -> validateThemeOverride(raw);
        };
    }

    public ValidationResult<CoreDocument> validateCore(String raw) {
        try {
            return validateCore(parse(raw));
        } catch (JsonProcessingException e) {
            return malformed(e);
        }
    }

    public ValidationResult<PlatformExtensionDocument> validatePlatformExtension(String raw) {
        try {
            return validatePlatformExtension(parse(raw));
        } catch (JsonProcessingException e) {
            return malformed(e);
        }
    }

    public ValidationResult<ThemeOverrideDocument> validateThemeOverride(String raw) {
        try {
            return validateThemeOverride(parse(raw));
        } catch (JsonProcessingException e) {
            return malformed(e);
        }
    }

    public ValidationResult<CoreDocument> validateCore(JsonNode root) {
        if (root == null || !root.isObject()) {
            return notAnObject(root);
        }
        FieldReader reader = new FieldReader();
        String systemId = reader.requiredString(root, "systemId", "");
        String systemName = reader.optionalString(root, "systemName", "");
        String version = reader.optionalString(root, "version", "");

        List<Token> tokens = reader.objects(root, "tokens", "", (node, p) -> readToken(reader, node, p));
        List<TokenCollection> collections = reader.objects(root, "tokenCollections", "",
                (node, p) -> readCollection(reader, node, p));
        List<Dimension> dimensions = reader.objects(root, "dimensions", "",
                (node, p) -> readDimension(reader, node, p));
        List<Platform> platforms = reader.objects(root, "platforms", "", (node, p) -> readPlatform(reader, node, p));
        List<Theme> themes = reader.objects(root, "themes", "", (node, p) -> readTheme(reader, node, p));
        List<Taxonomy> taxonomies = reader.objects(root, "taxonomies", "",
                (node, p) -> readTaxonomy(reader, node, p));
        List<Algorithm> algorithms = reader.objects(root, "algorithms", "",
                (node, p) -> readAlgorithm(reader, node, p));
        List<ValueType> valueTypes = reader.objects(root, "resolvedValueTypes", "",
                (node, p) -> readValueType(reader, node, p));

        NamingRules namingRules = NamingRules.empty();
        JsonNode rules = reader.optionalObject(root, "namingRules", "");
        if (rules != null) {
            namingRules = new NamingRules(reader.strings(rules, "taxonomyOrder", "namingRules"));
        }
        List<String> dimensionOrder = reader.strings(root, "dimensionOrder", "");

        uniqueIds(reader, "tokens", tokens);
        uniqueIds(reader, "tokenCollections", collections);
        uniqueIds(reader, "dimensions", dimensions);
        uniqueIds(reader, "platforms", platforms);
        uniqueIds(reader, "themes", themes);
        uniqueIds(reader, "taxonomies", taxonomies);
        uniqueIds(reader, "algorithms", algorithms);
        uniqueIds(reader, "resolvedValueTypes", valueTypes);

        if (reader.hasErrors()) {
            return ValidationResult.invalid(reader.errors());
        }
        return ValidationResult.valid(new CoreDocument(systemId, systemName, version, tokens, collections,
                dimensions, platforms, themes, taxonomies, algorithms, valueTypes, namingRules, dimensionOrder));
    }

    public ValidationResult<PlatformExtensionDocument> validatePlatformExtension(JsonNode root) {
        if (root == null || !root.isObject()) {
            return notAnObject(root);
        }
        FieldReader reader = new FieldReader();
        String systemId = reader.requiredString(root, "systemId", "");
        String platformId = reader.requiredString(root, "platformId", "");
        String version = reader.optionalString(root, "version", "");
        String figmaFileKey = reader.optionalString(root, "figmaFileKey", "");

        ExtensionMetadata metadata = null;
        JsonNode metadataNode = reader.optionalObject(root, "metadata", "");
        if (metadataNode != null) {
            metadata = new ExtensionMetadata(
                    reader.optionalString(metadataNode, "name", "metadata"),
                    reader.optionalString(metadataNode, "description", "metadata"),
                    reader.optionalString(metadataNode, "maintainer", "metadata"),
                    reader.optionalString(metadataNode, "lastUpdated", "metadata"));
        }
        SyntaxPatterns patterns = readSyntaxPatterns(reader, root, "");
        ValueFormatters formatters = readValueFormatters(reader, root, "");

        List<AlgorithmVariableOverride> variableOverrides = reader.objects(root, "algorithmVariableOverrides", "",
                (node, p) -> readVariableOverride(reader, node, p));
        List<TokenOverride> tokenOverrides = reader.objects(root, "tokenOverrides", "",
                (node, p) -> readTokenOverride(reader, node, p));
        List<String> omittedModes = reader.strings(root, "omittedModes", "");
        List<String> omittedDimensions = reader.strings(root, "omittedDimensions", "");

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < tokenOverrides.size(); i++) {
            if (!seen.add(tokenOverrides.get(i).id())) {
                reader.error(Codes.DUPLICATE_ID, index("tokenOverrides", i) + ".id",
                        "duplicate token override '" + tokenOverrides.get(i).id() + "'");
            }
        }

        if (reader.hasErrors()) {
            return ValidationResult.invalid(reader.errors());
        }
        return ValidationResult.valid(new PlatformExtensionDocument(systemId, platformId, version, figmaFileKey,
                metadata, patterns, formatters, variableOverrides, tokenOverrides, omittedModes, omittedDimensions));
    }

    public ValidationResult<ThemeOverrideDocument> validateThemeOverride(JsonNode root) {
        if (root == null || !root.isObject()) {
            return notAnObject(root);
        }
        FieldReader reader = new FieldReader();
        String systemId = reader.requiredString(root, "systemId", "");
        String themeId = reader.requiredString(root, "themeId", "");
        String figmaFileKey = reader.optionalString(root, "figmaFileKey", "");
        List<ThemeTokenOverride> overrides = reader.objects(root, "tokenOverrides", "", (node, p) -> {
            String tokenId = reader.requiredString(node, "tokenId", p);
            List<ValueByMode> values = readValuesByMode(reader, node, p);
            return tokenId == null ? null : new ThemeTokenOverride(tokenId, values == null ? List.of() : values);
        });

        if (reader.hasErrors()) {
            return ValidationResult.invalid(reader.errors());
        }
        return ValidationResult.valid(new ThemeOverrideDocument(systemId, themeId, figmaFileKey, overrides));
    }

    private Token readToken(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String valueTypeId = reader.optionalString(node, "resolvedValueTypeId", p);
        JsonNode valueTypeNode = node.get("resolvedValueTypeId");
        if (valueTypeNode == null || valueTypeNode.isNull()) {
            reader.error(Codes.VALUE_TYPE_REQUIRED, path(p, "resolvedValueTypeId"),
                    "token '" + id + "' has no resolvedValueTypeId");
        }
        String displayName = reader.optionalString(node, "displayName", p);
        Token token = new Token(
                id == null ? "" : id,
                displayName == null ? id : displayName,
                reader.optionalString(node, "description", p),
                reader.optionalString(node, "tokenCollectionId", p),
                valueTypeId,
                reader.optionalBoolean(node, "themeable", p),
                reader.optionalBoolean(node, "private", p),
                reader.optionalString(node, "status", p),
                reader.optionalString(node, "tokenTier", p),
                reader.optionalBoolean(node, "generatedByAlgorithm", p),
                reader.optionalString(node, "algorithmId", p),
                readTaxonomyRefs(reader, node, p),
                reader.strings(node, "propertyTypes", p),
                readCodeSyntax(reader, node, p),
                readValuesByMode(reader, node, p));
        return id == null ? null : token;
    }

    private TokenOverride readTokenOverride(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        TokenOverride fragment = new TokenOverride(
                id == null ? "" : id,
                reader.optionalString(node, "displayName", p),
                reader.optionalString(node, "description", p),
                reader.optionalString(node, "tokenCollectionId", p),
                reader.optionalString(node, "resolvedValueTypeId", p),
                reader.nullableBoolean(node, "themeable", p),
                reader.nullableBoolean(node, "private", p),
                reader.optionalString(node, "status", p),
                reader.optionalString(node, "tokenTier", p),
                reader.nullableBoolean(node, "generatedByAlgorithm", p),
                reader.optionalString(node, "algorithmId", p),
                node.has("taxonomies") ? readTaxonomyRefs(reader, node, p) : null,
                reader.stringsOrNull(node, "propertyTypes", p),
                node.has("codeSyntax") ? readCodeSyntax(reader, node, p) : null,
                readValuesByMode(reader, node, p),
                reader.nullableBoolean(node, "omit", p));
        return id == null ? null : fragment;
    }

    /**
     * Reads {@code valuesByMode}, returning {@code null} when absent.
     */
    private List<ValueByMode> readValuesByMode(FieldReader reader, JsonNode node, String p) {
        List<ValueByMode> values = reader.objectsOrNull(node, "valuesByMode", p, (entry, entryPath) -> {
            List<String> modeIds = reader.strings(entry, "modeIds", entryPath);
            TokenValue value = readValue(reader, entry.get("value"), path(entryPath, "value"));
            JsonNode metadata = reader.optionalObject(entry, "metadata", entryPath);
            return value == null ? null : new ValueByMode(modeIds, value, metadata);
        });
        if (values != null) {
            Set<Set<String>> seen = new HashSet<>();
            for (int i = 0; i < values.size(); i++) {
                if (!seen.add(values.get(i).modeSet())) {
                    reader.error(Codes.DUPLICATE_MODES, index(path(p, "valuesByMode"), i),
                            "mode set " + values.get(i).modeIds() + " appears more than once");
                }
            }
        }
        return values;
    }

    /**
     * A value is either {@code {"value": any}} or {@code {"tokenId": "..."}}.
     */
    private TokenValue readValue(FieldReader reader, JsonNode node, String p) {
        if (node == null || node.isNull()) {
            reader.error(Codes.REQUIRED, p, "'value' is required");
            return null;
        }
        if (!node.isObject()) {
            reader.error(Codes.VALUE_INVALID, p, "expected {\"value\": ...} or {\"tokenId\": ...}");
            return null;
        }
        JsonNode alias = node.get("tokenId");
        if (alias != null) {
            if (!alias.isTextual()) {
                reader.error(Codes.TYPE, path(p, "tokenId"), "expected string");
                return null;
            }
            return TokenValue.alias(alias.asText());
        }
        if (node.has("value")) {
            return TokenValue.literal(node.get("value"));
        }
        reader.error(Codes.VALUE_INVALID, p, "expected {\"value\": ...} or {\"tokenId\": ...}");
        return null;
    }

    private List<TaxonomyRef> readTaxonomyRefs(FieldReader reader, JsonNode node, String p) {
        return reader.objects(node, "taxonomies", p, (ref, refPath) -> {
            String taxonomyId = reader.requiredString(ref, "taxonomyId", refPath);
            String termId = reader.requiredString(ref, "termId", refPath);
            return taxonomyId == null || termId == null ? null : new TaxonomyRef(taxonomyId, termId);
        });
    }

    private List<CodeSyntax> readCodeSyntax(FieldReader reader, JsonNode node, String p) {
        return reader.objects(node, "codeSyntax", p, (entry, entryPath) -> new CodeSyntax(
                reader.requiredString(entry, "platformId", entryPath),
                reader.optionalString(entry, "formattedName", entryPath)));
    }

    private TokenCollection readCollection(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String name = reader.optionalString(node, "name", p);
        TokenCollection collection = new TokenCollection(id == null ? "" : id, name == null ? id : name,
                reader.optionalString(node, "description", p),
                reader.strings(node, "resolvedValueTypeIds", p),
                reader.optionalBoolean(node, "private", p),
                reader.strings(node, "defaultModeIds", p));
        return id == null ? null : collection;
    }

    private Dimension readDimension(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String displayName = reader.optionalString(node, "displayName", p);
        List<Mode> modes = reader.objects(node, "modes", p, (mode, modePath) -> {
            String modeId = reader.requiredString(mode, "id", modePath);
            String name = reader.optionalString(mode, "name", modePath);
            String dimensionId = reader.optionalString(mode, "dimensionId", modePath);
            return modeId == null ? null : new Mode(modeId, name == null ? modeId : name,
                    reader.optionalString(mode, "description", modePath), dimensionId == null ? id : dimensionId);
        });
        uniqueIds(reader, path(p, "modes"), modes);
        Dimension dimension = new Dimension(id == null ? "" : id, displayName == null ? id : displayName,
                reader.optionalString(node, "description", p), modes,
                reader.optionalBoolean(node, "required", p),
                reader.optionalString(node, "defaultMode", p));
        return id == null ? null : dimension;
    }

    private Platform readPlatform(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String displayName = reader.optionalString(node, "displayName", p);
        Platform platform = new Platform(id == null ? "" : id, displayName == null ? id : displayName,
                reader.optionalString(node, "description", p),
                readSyntaxPatterns(reader, node, p),
                readValueFormatters(reader, node, p),
                readExtensionSource(reader, node, "extensionSource", p));
        return id == null ? null : platform;
    }

    private Theme readTheme(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String displayName = reader.optionalString(node, "displayName", p);
        Theme theme = new Theme(id == null ? "" : id, displayName == null ? id : displayName,
                reader.optionalString(node, "description", p),
                reader.optionalBoolean(node, "isDefault", p),
                readExtensionSource(reader, node, "overrideSource", p));
        return id == null ? null : theme;
    }

    private ExtensionSource readExtensionSource(FieldReader reader, JsonNode node, String field, String p) {
        JsonNode source = reader.optionalObject(node, field, p);
        if (source == null) {
            return null;
        }
        String sourcePath = path(p, field);
        return new ExtensionSource(
                reader.requiredString(source, "repositoryUri", sourcePath),
                reader.requiredString(source, "filePath", sourcePath));
    }

    private Taxonomy readTaxonomy(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String name = reader.optionalString(node, "name", p);
        List<TaxonomyTerm> terms = reader.objects(node, "terms", p, (term, termPath) -> {
            String termId = reader.requiredString(term, "id", termPath);
            String termName = reader.optionalString(term, "name", termPath);
            return termId == null ? null : new TaxonomyTerm(termId, termName == null ? termId : termName,
                    reader.optionalString(term, "description", termPath));
        });
        Taxonomy taxonomy = new Taxonomy(id == null ? "" : id, name == null ? id : name,
                reader.optionalString(node, "description", p), terms);
        return id == null ? null : taxonomy;
    }

    private Algorithm readAlgorithm(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        List<AlgorithmVariable> variables = reader.objects(node, "variables", p, (variable, variablePath) -> {
            String variableId = reader.requiredString(variable, "id", variablePath);
            return variableId == null ? null : new AlgorithmVariable(variableId,
                    reader.optionalString(variable, "name", variablePath),
                    reader.optionalString(variable, "type", variablePath),
                    readModeValues(reader, variable, variablePath));
        });
        Algorithm algorithm = new Algorithm(id == null ? "" : id, reader.optionalString(node, "name", p),
                reader.optionalString(node, "description", p), variables);
        return id == null ? null : algorithm;
    }

    private AlgorithmVariableOverride readVariableOverride(FieldReader reader, JsonNode node, String p) {
        String algorithmId = reader.requiredString(node, "algorithmId", p);
        String variableId = reader.requiredString(node, "variableId", p);
        List<ModeValue> values = readModeValues(reader, node, p);
        return algorithmId == null || variableId == null ? null
                : new AlgorithmVariableOverride(algorithmId, variableId, values);
    }

    private List<ModeValue> readModeValues(FieldReader reader, JsonNode node, String p) {
        return reader.objects(node, "valuesByMode", p, (entry, entryPath) -> {
            if (!entry.has("value")) {
                reader.error(Codes.REQUIRED, path(entryPath, "value"), "'value' is required");
                return null;
            }
            return new ModeValue(reader.strings(entry, "modeIds", entryPath), entry.get("value"));
        });
    }

    private ValueType readValueType(FieldReader reader, JsonNode node, String p) {
        String id = reader.requiredString(node, "id", p);
        String displayName = reader.optionalString(node, "displayName", p);
        ValueType valueType = new ValueType(id == null ? "" : id, displayName == null ? id : displayName,
                reader.optionalString(node, "type", p));
        return id == null ? null : valueType;
    }

    private SyntaxPatterns readSyntaxPatterns(FieldReader reader, JsonNode node, String p) {
        JsonNode patterns = reader.optionalObject(node, "syntaxPatterns", p);
        if (patterns == null) {
            return null;
        }
        String patternsPath = path(p, "syntaxPatterns");
        return new SyntaxPatterns(
                reader.optionalString(patterns, "prefix", patternsPath),
                reader.optionalString(patterns, "suffix", patternsPath),
                reader.optionalString(patterns, "delimiter", patternsPath),
                reader.optionalString(patterns, "capitalization", patternsPath),
                reader.optionalString(patterns, "formatString", patternsPath));
    }

    private ValueFormatters readValueFormatters(FieldReader reader, JsonNode node, String p) {
        JsonNode formatters = reader.optionalObject(node, "valueFormatters", p);
        if (formatters == null) {
            return null;
        }
        String formattersPath = path(p, "valueFormatters");
        return new ValueFormatters(
                reader.optionalString(formatters, "color", formattersPath),
                reader.optionalString(formatters, "dimension", formattersPath),
                reader.optionalInt(formatters, "numberPrecision", formattersPath));
    }

    private static void uniqueIds(FieldReader reader, String field, List<? extends Identified> entities) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entities.size(); i++) {
            String id = entities.get(i).id();
            if (!seen.add(id)) {
                reader.error(Codes.DUPLICATE_ID, index(field, i) + ".id", "duplicate id '" + id + "'");
            }
        }
    }

    private JsonNode parse(String raw) throws JsonProcessingException {
        return raw == null ? null : objectMapper.readTree(raw);
    }

    private static <T> ValidationResult<T> malformed(JsonProcessingException e) {
        return ValidationResult.invalid(List.of(new ValidationError(Codes.MALFORMED, "",
                "document is not valid JSON: " + e.getOriginalMessage())));
    }

    private static <T> ValidationResult<T> notAnObject(JsonNode root) {
        String found = root == null ? "nothing" : root.getNodeType().name().toLowerCase();
        return ValidationResult.invalid(List.of(
                new ValidationError(Codes.NOT_OBJECT, "", "expected a JSON object but found " + found)));
    }
}
