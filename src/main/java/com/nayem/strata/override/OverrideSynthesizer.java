package com.nayem.strata.override;

import com.nayem.strata.model.CodeSyntax;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.TaxonomyRef;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.ValueByMode;
import com.nayem.strata.validation.PolicyViolation;
import com.nayem.strata.validation.ValidationError;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a token edit into the smallest override fragment that reproduces it in
 * the document behind the active editing lens.
 * <p>
 * Only fields that changed are written, and of {@code valuesByMode} only the
 * entries, matched by mode set, whose value or metadata changed. Entries
 * removed by the edit cannot be expressed as an override and are ignored.
 * </p>
 */
public class OverrideSynthesizer {

    interface Codes {
        String SOURCE_ID_REQUIRED = "override.source_id.required";
        String SYSTEM_ID_REQUIRED = "override.system_id.required";
    }

    /**
     * @param edited   the token after the edit
     * @param original the token before the edit, {@code null} for a new token
     * @param context  the active editing lens
     */
    public SynthesisResult synthesize(Token edited, Token original, EditContext context) {
        Objects.requireNonNull(edited, "edited");
        Objects.requireNonNull(context, "context");
        return switch (context.sourceType()) {
            case CORE -> SynthesisResult.nothingToPersist();
            case PLATFORM_EXTENSION -> forPlatform(edited, original, context);
            case THEME_OVERRIDE -> forTheme(edited, original, context);
        };
    }

    /**
     * The fields that differ between {@code original} and {@code edited}. For a
     * new token, every field it defines.
     */
    public List<TokenField> changedFields(Token edited, Token original) {
        List<TokenField> changed = new ArrayList<>();
        for (TokenField field : TokenField.values()) {
            if (original == null ? field.isDefinedOn(edited)
                    : field == TokenField.VALUES_BY_MODE ? !changedValues(edited, original).isEmpty()
                    : !Objects.equals(field.read(edited), field.read(original))) {
                changed.add(field);
            }
        }
        return changed;
    }

    /**
     * The entries of {@code edited} that are new or differ from the entry with
     * the same mode set in {@code original}.
     */
    public List<ValueByMode> changedValues(Token edited, Token original) {
        if (original == null) {
            return edited.valuesByMode();
        }
        List<ValueByMode> changed = new ArrayList<>();
        for (ValueByMode entry : edited.valuesByMode()) {
            ValueByMode before = original.valueFor(entry.modeSet());
            if (before == null || entry.differsFrom(before)) {
                changed.add(entry);
            }
        }
        return changed;
    }

    private SynthesisResult forPlatform(Token edited, Token original, EditContext context) {
        SynthesisResult missing = checkIdentity(context);
        if (missing != null) {
            return missing;
        }
        List<TokenField> changed = changedFields(edited, original);
        if (changed.isEmpty()) {
            return SynthesisResult.nothingToPersist();
        }
        TokenOverride fragment = fragment(edited, original, EnumSet.copyOf(changed));
        PlatformExtensionDocument payload = new PlatformExtensionDocument(context.systemId(), context.sourceId(),
                context.version(), null, null, null, null, null, List.of(fragment), null, null);
        return SynthesisResult.success(payload, changed);
    }

    private SynthesisResult forTheme(Token edited, Token original, EditContext context) {
        SynthesisResult missing = checkIdentity(context);
        if (missing != null) {
            return missing;
        }
        if (!edited.themeable()) {
            return SynthesisResult.failure(PolicyViolation.notThemeable(edited.id()));
        }
        List<ValueByMode> values = changedValues(edited, original);
        if (values.isEmpty()) {
            return SynthesisResult.nothingToPersist();
        }
        ThemeOverrideDocument payload = ThemeOverrideDocument.of(context.systemId(), context.sourceId(),
                List.of(new ThemeTokenOverride(edited.id(), values)));
        return SynthesisResult.success(payload, List.of(TokenField.VALUES_BY_MODE));
    }

    private static SynthesisResult checkIdentity(EditContext context) {
        if (!context.hasSourceId()) {
            return SynthesisResult.failure(new ValidationError(Codes.SOURCE_ID_REQUIRED, "sourceId",
                    "a " + context.sourceType().wireName() + " edit needs a source id"));
        }
        if (context.systemId() == null || context.systemId().isBlank()) {
            return SynthesisResult.failure(new ValidationError(Codes.SYSTEM_ID_REQUIRED, "systemId",
                    "a " + context.sourceType().wireName() + " edit needs a system id"));
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private TokenOverride fragment(Token edited, Token original, Set<TokenField> changed) {
        return new TokenOverride(
                edited.id(),
                (String) pick(changed, TokenField.DISPLAY_NAME, edited),
                (String) pick(changed, TokenField.DESCRIPTION, edited),
                (String) pick(changed, TokenField.TOKEN_COLLECTION_ID, edited),
                (String) pick(changed, TokenField.RESOLVED_VALUE_TYPE_ID, edited),
                (Boolean) pick(changed, TokenField.THEMEABLE, edited),
                (Boolean) pick(changed, TokenField.PRIVATE, edited),
                (String) pick(changed, TokenField.STATUS, edited),
                (String) pick(changed, TokenField.TOKEN_TIER, edited),
                (Boolean) pick(changed, TokenField.GENERATED_BY_ALGORITHM, edited),
                (String) pick(changed, TokenField.ALGORITHM_ID, edited),
                (List<TaxonomyRef>) pick(changed, TokenField.TAXONOMIES, edited),
                (List<String>) pick(changed, TokenField.PROPERTY_TYPES, edited),
                (List<CodeSyntax>) pick(changed, TokenField.CODE_SYNTAX, edited),
                changed.contains(TokenField.VALUES_BY_MODE) ? changedValues(edited, original) : null,
                null);
    }

    private static Object pick(Set<TokenField> changed, TokenField field, Token edited) {
        return changed.contains(field) ? field.read(edited) : null;
    }
}
