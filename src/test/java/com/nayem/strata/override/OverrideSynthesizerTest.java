package com.nayem.strata.override;

import com.nayem.strata.SampleDocuments;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceType;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.validation.PolicyViolation;
import com.nayem.strata.validation.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nayem.strata.SampleDocuments.text;
import static com.nayem.strata.SampleDocuments.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OverrideSynthesizerTest {

    private final OverrideSynthesizer synthesizer = new OverrideSynthesizer();

    private static Token t1(String value) {
        return Token.builder("T1")
                .displayName("T1")
                .resolvedValueTypeId("color")
                .value(List.of("light"), text(value))
                .build();
    }

    @Test
    void platformEditWritesOnlyTheChangedValue() {
        SynthesisResult result = synthesizer.synthesize(t1("#111"), t1("#000"),
                EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        assertTrue(result.isSuccess());
        assertEquals(List.of(TokenField.VALUES_BY_MODE), result.changedFields());
        PlatformExtensionDocument payload = (PlatformExtensionDocument) result.payload();
        assertEquals("ios", payload.platformId());
        assertEquals(SampleDocuments.SYSTEM_ID, payload.systemId());
        assertThat(payload.tokenOverrides()).hasSize(1);

        TokenOverride fragment = payload.tokenOverrides().get(0);
        assertEquals("T1", fragment.id());
        assertEquals(List.of(value("light", "#111")), fragment.valuesByMode());
        assertNull(fragment.displayName());
        assertNull(fragment.resolvedValueTypeId());
        assertNull(fragment.themeable());
        assertNull(fragment.omit());
    }

    @Test
    void onlyEditedModeEntriesAreWritten() {
        Token original = SampleDocuments.primaryColor();
        Token edited = original.toBuilder()
                .valuesByMode(List.of(value("light", "#0055ff"), value("dark", "#000000")))
                .build();

        SynthesisResult result = synthesizer.synthesize(edited, original,
                EditContext.platform(SampleDocuments.SYSTEM_ID, "web"));

        TokenOverride fragment = ((PlatformExtensionDocument) result.payload()).tokenOverrides().get(0);
        assertEquals(List.of(value("dark", "#000000")), fragment.valuesByMode());
    }

    @Test
    void scalarFieldChangesAreWrittenAlongsideValues() {
        Token original = t1("#000");
        Token edited = original.toBuilder().displayName("Ink").status("deprecated").build();

        SynthesisResult result = synthesizer.synthesize(edited, original,
                EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        assertThat(result.changedFields()).containsExactly(TokenField.DISPLAY_NAME, TokenField.STATUS);
        TokenOverride fragment = ((PlatformExtensionDocument) result.payload()).tokenOverrides().get(0);
        assertEquals("Ink", fragment.displayName());
        assertEquals("deprecated", fragment.status());
        assertNull(fragment.valuesByMode());
    }

    @Test
    void unchangedTokenHasNothingToPersist() {
        SynthesisResult result = synthesizer.synthesize(t1("#000"), t1("#000"),
                EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        assertTrue(result.isSuccess());
        assertFalse(result.hasPayload());
    }

    @Test
    void coreEditsAreNeverOverrides() {
        SynthesisResult result = synthesizer.synthesize(t1("#111"), t1("#000"),
                EditContext.core(SampleDocuments.SYSTEM_ID));

        assertTrue(result.isSuccess());
        assertFalse(result.hasPayload());
    }

    @Test
    void themeEditOfThemeableTokenWritesValues() {
        Token original = SampleDocuments.primaryColor();
        Token edited = original.toBuilder()
                .valuesByMode(List.of(value("light", "#003399"), value("dark", "#66aaff")))
                .build();

        SynthesisResult result = synthesizer.synthesize(edited, original,
                EditContext.theme(SampleDocuments.SYSTEM_ID, "ocean"));

        assertTrue(result.isSuccess());
        ThemeOverrideDocument payload = (ThemeOverrideDocument) result.payload();
        assertEquals(SourceType.THEME_OVERRIDE, payload.sourceType());
        assertEquals("ocean", payload.sourceId());
        assertEquals(List.of(new ThemeTokenOverride("color.primary", List.of(value("light", "#003399")))),
                payload.tokenOverrides());
    }

    @Test
    void themeEditOfNonThemeableTokenIsAPolicyViolation() {
        Token original = SampleDocuments.smallSpacing();
        Token edited = original.toBuilder()
                .valuesByMode(List.of(value("compact", "2px"), value("comfortable", "8px")))
                .build();

        SynthesisResult result = synthesizer.synthesize(edited, original,
                EditContext.theme(SampleDocuments.SYSTEM_ID, "ocean"));

        assertFalse(result.isSuccess());
        assertFalse(result.hasPayload());
        assertThat(result.problem()).isInstanceOf(PolicyViolation.class);
        PolicyViolation violation = (PolicyViolation) result.problem();
        assertEquals(PolicyViolation.THEMEABLE_ONLY, violation.rule());
        assertEquals("spacing.small", violation.subjectId());
    }

    @Test
    void extensionEditsNeedASourceId() {
        EditContext anonymous = new EditContext(SourceType.PLATFORM_EXTENSION, " ", SampleDocuments.SYSTEM_ID, null);

        SynthesisResult result = synthesizer.synthesize(t1("#111"), t1("#000"), anonymous);

        assertFalse(result.isSuccess());
        assertThat(result.problem()).isInstanceOf(ValidationError.class);
        assertEquals(OverrideSynthesizer.Codes.SOURCE_ID_REQUIRED, ((ValidationError) result.problem()).code());
    }

    @Test
    void newTokenCarriesAllItsValues() {
        Token created = t1("#111").toBuilder()
                .valuesByMode(List.of(value("light", "#111"), value("dark", "#eee")))
                .build();

        SynthesisResult result = synthesizer.synthesize(created, null,
                EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        assertThat(result.changedFields()).contains(TokenField.DISPLAY_NAME, TokenField.VALUES_BY_MODE);
        TokenOverride fragment = ((PlatformExtensionDocument) result.payload()).tokenOverrides().get(0);
        assertEquals("T1", fragment.displayName());
        assertThat(fragment.valuesByMode()).hasSize(2);
    }
}
