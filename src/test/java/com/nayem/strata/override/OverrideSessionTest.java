package com.nayem.strata.override;

import com.nayem.strata.SampleDocuments;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.nayem.strata.SampleDocuments.text;
import static com.nayem.strata.SampleDocuments.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OverrideSessionTest {

    private OverrideTracker tracker;

    private static Token t1(String value) {
        return Token.builder("T1").resolvedValueTypeId("color").value(List.of("light"), text(value)).build();
    }

    @BeforeEach
    void setUp() {
        tracker = new OverrideTracker(new OverrideSynthesizer());
    }

    @Test
    void repeatedEditsKeepTheFirstOriginal() {
        OverrideSession session = tracker.begin(EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        session.record(t1("#111"), t1("#000"));
        session.record(t1("#222"), t1("#111"));

        assertEquals(1, session.pendingCount());
        OverrideChange change = session.changes().get(0);
        assertEquals(t1("#000"), change.originalValue());
        assertEquals(t1("#222"), change.newValue());
        assertEquals("ios", change.sourceId());
    }

    @Test
    void revertingAnEditDropsIt() {
        OverrideSession session = tracker.begin(EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        session.record(t1("#111"), t1("#000"));
        assertEquals(1, tracker.pendingOverrideCount());

        SynthesisResult result = session.record(t1("#000"), t1("#111"));

        assertTrue(result.isSuccess());
        assertFalse(result.hasPayload());
        assertEquals(0, tracker.pendingOverrideCount());
    }

    @Test
    void rejectedEditLeavesSessionUntouched() {
        OverrideSession session = tracker.begin(EditContext.theme(SampleDocuments.SYSTEM_ID, "ocean"));
        Token spacing = SampleDocuments.smallSpacing();

        SynthesisResult result = session.record(
                spacing.toBuilder().valuesByMode(List.of(value("compact", "2px"))).build(), spacing);

        assertFalse(result.isSuccess());
        assertEquals(0, session.pendingCount());
    }

    @Test
    void foldMergesEditsIntoTheStoredExtension() {
        OverrideSession session = tracker.begin(EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));
        PlatformExtensionDocument stored = PlatformExtensionDocument.of(SampleDocuments.SYSTEM_ID, "ios", List.of(
                TokenOverride.values("T1", List.of(value("dark", "#999"))),
                TokenOverride.omitted("legacy.token")));

        session.record(t1("#111"), t1("#000"));

        Optional<SourceDocument> folded = session.fold(stored);

        assertTrue(folded.isPresent());
        PlatformExtensionDocument document = (PlatformExtensionDocument) folded.get();
        assertThat(document.tokenOverrides()).extracting(TokenOverride::id).containsExactly("T1", "legacy.token");
        assertThat(document.tokenOverrides().get(0).valuesByMode())
                .containsExactlyInAnyOrder(value("dark", "#999"), value("light", "#111"));
    }

    @Test
    void foldWithoutStoredThemeBuildsANewDocument() {
        OverrideSession session = tracker.begin(EditContext.theme(SampleDocuments.SYSTEM_ID, "ocean"));
        Token primary = SampleDocuments.primaryColor();

        session.record(primary.toBuilder()
                .valuesByMode(List.of(value("light", "#003399"), value("dark", "#66aaff")))
                .build(), primary);

        ThemeOverrideDocument document = (ThemeOverrideDocument) session.fold(null).orElseThrow();

        assertEquals("ocean", document.sourceId());
        assertEquals(List.of(new ThemeTokenOverride("color.primary", List.of(value("light", "#003399")))),
                document.tokenOverrides());
    }

    @Test
    void foldOfEmptySessionIsEmpty() {
        OverrideSession session = tracker.begin(EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));

        assertTrue(session.fold(null).isEmpty());
    }

    @Test
    void endingTheSessionClearsPendingCount() {
        OverrideSession session = tracker.begin(EditContext.platform(SampleDocuments.SYSTEM_ID, "ios"));
        session.record(t1("#111"), t1("#000"));
        tracker.stageConfigurationChange();

        tracker.end();

        assertEquals(0, tracker.pendingOverrideCount());
        assertEquals(1, tracker.stagedConfigurationCount());
        assertTrue(tracker.current().isEmpty());
    }
}
