package com.nayem.strata.override;

import com.nayem.strata.merge.Layering;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the edits made through one editing lens until they are persisted.
 * <p>
 * Edits are keyed by token. A later edit of the same token replaces the
 * earlier one but keeps the token's state from before the session, so an edit
 * that is reverted drops out of the session entirely.
 * </p>
 */
public class OverrideSession {

    private static final Logger log = LoggerFactory.getLogger(OverrideSession.class);

    private final EditContext context;
    private final OverrideSynthesizer synthesizer;
    private final Map<String, OverrideChange> changes = new LinkedHashMap<>();

    public OverrideSession(EditContext context, OverrideSynthesizer synthesizer) {
        this.context = context;
        this.synthesizer = synthesizer;
    }

    public EditContext context() {
        return context;
    }

    /**
     * Records an edit. A failed synthesis leaves the session untouched.
     */
    public synchronized SynthesisResult record(Token edited, Token original) {
        OverrideChange previous = changes.get(edited.id());
        Token baseline = previous != null ? previous.originalValue() : original;
        SynthesisResult result = synthesizer.synthesize(edited, baseline, context);
        if (!result.isSuccess()) {
            log.debug("Rejected edit of {} through {}: {}", edited.id(), context.sourceType().wireName(),
                    result.problem().message());
            return result;
        }
        if (result.hasPayload()) {
            changes.put(edited.id(), new OverrideChange(edited.id(), baseline, edited, context.sourceType(),
                    context.sourceId(), Instant.now()));
        } else {
            changes.remove(edited.id());
        }
        return result;
    }

    public synchronized int pendingCount() {
        return changes.size();
    }

    public synchronized List<OverrideChange> changes() {
        return List.copyOf(changes.values());
    }

    public synchronized void discard(String tokenId) {
        changes.remove(tokenId);
    }

    public synchronized void clear() {
        changes.clear();
    }

    /**
     * Folds every pending edit into one document ready to persist.
     *
     * @param stored the document currently backing this lens, if any; its
     *               other content is kept and edited fragments are merged into
     *               it field by field
     * @return empty for core edits or when nothing is pending
     */
    public synchronized Optional<SourceDocument> fold(SourceDocument stored) {
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        List<SourceDocument> payloads = new ArrayList<>();
        for (OverrideChange change : changes.values()) {
            SynthesisResult result = synthesizer.synthesize(change.newValue(), change.originalValue(), context);
            if (result.hasPayload()) {
                payloads.add(result.payload());
            }
        }
        return switch (context.sourceType()) {
            case CORE -> Optional.empty();
            case PLATFORM_EXTENSION -> Optional.of(foldPlatform((PlatformExtensionDocument) stored, payloads));
            case THEME_OVERRIDE -> Optional.of(foldTheme((ThemeOverrideDocument) stored, payloads));
        };
    }

    private PlatformExtensionDocument foldPlatform(PlatformExtensionDocument stored, List<SourceDocument> payloads) {
        Map<String, TokenOverride> fragments = new LinkedHashMap<>();
        if (stored != null) {
            stored.tokenOverrides().forEach(fragment -> fragments.put(fragment.id(), fragment));
        }
        for (SourceDocument payload : payloads) {
            for (TokenOverride fragment : ((PlatformExtensionDocument) payload).tokenOverrides()) {
                fragments.merge(fragment.id(), fragment, Layering::mergeFragments);
            }
        }
        List<TokenOverride> merged = List.copyOf(fragments.values());
        return stored != null ? stored.withTokenOverrides(merged)
                : PlatformExtensionDocument.of(context.systemId(), context.sourceId(), merged);
    }

    private ThemeOverrideDocument foldTheme(ThemeOverrideDocument stored, List<SourceDocument> payloads) {
        Map<String, ThemeTokenOverride> overrides = new LinkedHashMap<>();
        if (stored != null) {
            stored.tokenOverrides().forEach(override -> overrides.put(override.tokenId(), override));
        }
        for (SourceDocument payload : payloads) {
            for (ThemeTokenOverride override : ((ThemeOverrideDocument) payload).tokenOverrides()) {
                overrides.merge(override.tokenId(), override, (earlier, later) -> new ThemeTokenOverride(
                        earlier.tokenId(), Layering.mergeValues(earlier.valuesByMode(), later.valuesByMode())));
            }
        }
        List<ThemeTokenOverride> merged = List.copyOf(overrides.values());
        return stored != null ? stored.withTokenOverrides(merged)
                : ThemeOverrideDocument.of(context.systemId(), context.sourceId(), merged);
    }
}
