package com.nayem.strata.merge;

import com.nayem.strata.model.Algorithm;
import com.nayem.strata.model.AlgorithmVariable;
import com.nayem.strata.model.AlgorithmVariableOverride;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.Dimension;
import com.nayem.strata.model.Mode;
import com.nayem.strata.model.Platform;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.ValueByMode;
import com.nayem.strata.validation.PolicyViolation;
import com.nayem.strata.validation.ReferenceValidator;
import com.nayem.strata.validation.ValidationError;
import com.nayem.strata.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines one core document, any number of platform extensions and at most
 * one theme override into a resolved view.
 * <p>
 * Layers apply strictly in the order core, platform extensions (as supplied),
 * theme; the last writer of a field wins. Every call starts from the core
 * document, so merging the same inputs twice yields equal results.
 * </p>
 * <p>
 * A layer that fails its reference check against the core is excluded and
 * reported, never allowed to abort the merge. Theme overrides may target only
 * tokens that exist and are themeable; anything else is reported as a
 * {@link PolicyViolation} and skipped.
 * </p>
 */
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final ReferenceValidator referenceValidator;

    public MergeEngine() {
        this(new ReferenceValidator());
    }

    public MergeEngine(ReferenceValidator referenceValidator) {
        this.referenceValidator = referenceValidator;
    }

    /**
     * A layer as it came out of schema validation, possibly invalid.
     */
    public record Candidate<T extends SourceDocument>(SourceKey key, ValidationResult<T> result) {
    }

    public MergeResult merge(CoreDocument core, List<PlatformExtensionDocument> extensions,
            ThemeOverrideDocument theme) {
        return merge(core, extensions, theme, MergeOptions.DEFAULT);
    }

    public MergeResult merge(CoreDocument core, List<PlatformExtensionDocument> extensions,
            ThemeOverrideDocument theme, MergeOptions options) {
        List<Candidate<PlatformExtensionDocument>> candidates = extensions.stream()
                .map(extension -> new Candidate<>(extension.sourceKey(), ValidationResult.valid(extension)))
                .toList();
        Candidate<ThemeOverrideDocument> themeCandidate = theme == null ? null
                : new Candidate<>(theme.sourceKey(), ValidationResult.valid(theme));
        return mergeCandidates(core, candidates, themeCandidate, options);
    }

    /**
     * Merges layers that may have failed schema validation. Invalid layers are
     * excluded and each of their errors is reported as an issue.
     */
    public MergeResult mergeCandidates(CoreDocument core, List<Candidate<PlatformExtensionDocument>> extensions,
            Candidate<ThemeOverrideDocument> theme, MergeOptions options) {
        Run run = new Run(core, options);
        for (Candidate<PlatformExtensionDocument> candidate : extensions) {
            PlatformExtensionDocument extension = candidate.result().document();
            if (extension != null && !options.admits(extension.platformId())) {
                continue;
            }
            if (admit(run, candidate, extension == null ? List.of()
                    : referenceValidator.validateAgainstCore(core, extension))) {
                run.applyExtension(extension);
            }
        }
        if (theme != null) {
            ThemeOverrideDocument document = theme.result().document();
            if (admit(run, theme, document == null ? List.of()
                    : referenceValidator.validateAgainstCore(core, document))) {
                run.applyTheme(document);
            }
        }
        return run.finish();
    }

    private static boolean admit(Run run, Candidate<?> candidate, List<ValidationError> referenceErrors) {
        List<ValidationError> errors = candidate.result().isValid() ? referenceErrors : candidate.result().errors();
        if (errors.isEmpty()) {
            return true;
        }
        log.warn("Excluding {} from merge: {} problem(s), first: {}", candidate.key(), errors.size(), errors.get(0));
        errors.forEach(error -> run.issues.add(new MergeIssue(candidate.key(), error)));
        run.excluded.add(candidate.key());
        return false;
    }

    /**
     * Mutable state of a single merge call.
     */
    private static final class Run {
        private final CoreDocument core;
        private final MergeOptions options;
        private final SourceKey coreKey;

        private final Map<String, Token> tokens = new LinkedHashMap<>();
        private final Map<String, TokenProvenance> provenance = new LinkedHashMap<>();
        private final List<Dimension> dimensions;
        private final List<String> dimensionOrder;
        private final Map<String, Platform> platforms = new LinkedHashMap<>();
        private final Map<String, Algorithm> algorithms = new LinkedHashMap<>();

        private final Set<String> overridden = new HashSet<>();
        private final Set<String> introduced = new HashSet<>();
        private final Set<String> omitted = new LinkedHashSet<>();
        private final Map<SourceKey, Integer> breakdown = new LinkedHashMap<>();
        private final List<MergeIssue> issues = new ArrayList<>();
        private final Set<SourceKey> excluded = new LinkedHashSet<>();
        private int platformCount;
        private int themeCount;

        Run(CoreDocument core, MergeOptions options) {
            this.core = core;
            this.options = options;
            this.coreKey = core.sourceKey();
            for (Token token : core.tokens()) {
                tokens.put(token.id(), token);
                provenance.put(token.id(), new TokenProvenance(coreKey, coreKey));
            }
            this.dimensions = new ArrayList<>(core.dimensions());
            this.dimensionOrder = new ArrayList<>(core.dimensionOrder());
            core.platforms().forEach(platform -> platforms.put(platform.id(), platform));
            core.algorithms().forEach(algorithm -> algorithms.put(algorithm.id(), algorithm));
            breakdown.put(coreKey, core.tokens().size());
        }

        void applyExtension(PlatformExtensionDocument extension) {
            SourceKey key = extension.sourceKey();
            int touched = 0;
            for (TokenOverride fragment : extension.tokenOverrides()) {
                Token existing = tokens.get(fragment.id());
                if (fragment.isOmitted()) {
                    if (existing != null && !options.includeOmitted()) {
                        remove(fragment.id());
                        touched++;
                    }
                    continue;
                }
                if (existing != null) {
                    Token updated = Layering.applyOverride(existing, fragment);
                    if (!updated.equals(existing)) {
                        write(key, updated);
                        touched++;
                    }
                } else if (fragment.resolvedValueTypeId() == null) {
                    issues.add(new MergeIssue(key, new ValidationError("merge.token.value_type.required",
                            "tokenOverrides." + fragment.id(),
                            "new token '" + fragment.id() + "' has no resolvedValueTypeId and was skipped")));
                } else {
                    Token created = Layering.fromOverride(fragment);
                    tokens.put(created.id(), created);
                    provenance.put(created.id(), new TokenProvenance(key, key));
                    introduced.add(created.id());
                    omitted.remove(created.id());
                    touched++;
                }
            }
            touched += applyOmissions(extension);
            platforms.computeIfPresent(extension.platformId(), (id, platform) -> extension.hasFormatting()
                    ? platform.withPatterns(
                            extension.syntaxPatterns() != null ? extension.syntaxPatterns() : platform.syntaxPatterns(),
                            extension.valueFormatters() != null ? extension.valueFormatters()
                                    : platform.valueFormatters())
                    : platform);
            for (AlgorithmVariableOverride variableOverride : extension.algorithmVariableOverrides()) {
                algorithms.computeIfPresent(variableOverride.algorithmId(),
                        (id, algorithm) -> withVariable(algorithm, variableOverride));
            }
            breakdown.merge(key, touched, Integer::sum);
            platformCount++;
        }

        private int applyOmissions(PlatformExtensionDocument extension) {
            Set<String> omittedModes = new HashSet<>(extension.omittedModes());
            Set<String> omittedDimensions = new HashSet<>(extension.omittedDimensions());
            for (Dimension dimension : dimensions) {
                if (omittedDimensions.contains(dimension.id())) {
                    dimension.modes().forEach(mode -> omittedModes.add(mode.id()));
                }
            }
            if (omittedModes.isEmpty()) {
                return 0;
            }

            int touched = 0;
            for (Token token : List.copyOf(tokens.values())) {
                List<ValueByMode> kept = Layering.withoutModes(token.valuesByMode(), omittedModes);
                if (kept.size() == token.valuesByMode().size()) {
                    continue;
                }
                touched++;
                if (kept.isEmpty()) {
                    remove(token.id());
                } else {
                    tokens.put(token.id(), token.toBuilder().valuesByMode(kept).build());
                }
            }

            List<Dimension> remaining = new ArrayList<>();
            for (Dimension dimension : dimensions) {
                if (omittedDimensions.contains(dimension.id())) {
                    continue;
                }
                List<Mode> modes = dimension.modes().stream()
                        .filter(mode -> !omittedModes.contains(mode.id()))
                        .toList();
                String defaultMode = omittedModes.contains(dimension.defaultMode()) ? null : dimension.defaultMode();
                remaining.add(new Dimension(dimension.id(), dimension.displayName(), dimension.description(), modes,
                        dimension.required(), defaultMode));
            }
            dimensions.clear();
            dimensions.addAll(remaining);
            dimensionOrder.removeAll(omittedDimensions);
            return touched;
        }

        void applyTheme(ThemeOverrideDocument theme) {
            SourceKey key = theme.sourceKey();
            int touched = 0;
            for (ThemeTokenOverride override : theme.tokenOverrides()) {
                Token target = tokens.get(override.tokenId());
                if (target == null) {
                    violation(key, PolicyViolation.unknownThemeTarget(override.tokenId()));
                    continue;
                }
                Token coreEntry = core.token(override.tokenId());
                boolean themeable = coreEntry != null ? coreEntry.themeable() : target.themeable();
                if (!themeable) {
                    violation(key, PolicyViolation.notThemeable(override.tokenId()));
                    continue;
                }
                List<ValueByMode> values = Layering.mergeValues(target.valuesByMode(), override.valuesByMode());
                if (!values.equals(target.valuesByMode())) {
                    write(key, target.toBuilder().valuesByMode(values).build());
                    touched++;
                }
            }
            breakdown.merge(key, touched, Integer::sum);
            themeCount = 1;
        }

        private void violation(SourceKey key, PolicyViolation violation) {
            log.warn("Skipping override from {}: {}", key, violation.message());
            issues.add(new MergeIssue(key, violation));
        }

        private void write(SourceKey key, Token token) {
            tokens.put(token.id(), token);
            provenance.computeIfPresent(token.id(), (id, current) -> current.writtenBy(key));
            if (core.token(token.id()) != null) {
                overridden.add(token.id());
            }
        }

        private void remove(String tokenId) {
            tokens.remove(tokenId);
            provenance.remove(tokenId);
            omitted.add(tokenId);
        }

        private static Algorithm withVariable(Algorithm algorithm, AlgorithmVariableOverride override) {
            List<AlgorithmVariable> variables = algorithm.variables().stream()
                    .map(variable -> variable.id().equals(override.variableId())
                            ? variable.withValuesByMode(
                                    Layering.mergeModeValues(variable.valuesByMode(), override.valuesByMode()))
                            : variable)
                    .toList();
            return algorithm.withVariables(variables);
        }

        MergeResult finish() {
            Set<String> present = tokens.keySet();
            int overriddenCount = (int) overridden.stream().filter(present::contains).count();
            int newCount = (int) introduced.stream().filter(present::contains).count();
            int omittedCount = (int) omitted.stream().filter(id -> !present.contains(id)).count();

            MergedView view = new MergedView(
                    List.copyOf(tokens.values()),
                    core.tokenCollections(),
                    dimensions,
                    List.copyOf(platforms.values()),
                    core.themes(),
                    core.taxonomies(),
                    List.copyOf(algorithms.values()),
                    core.resolvedValueTypes(),
                    core.namingRules().taxonomyOrder(),
                    dimensionOrder,
                    provenance);
            MergeAnalytics analytics = new MergeAnalytics(tokens.size(), overriddenCount, newCount, omittedCount,
                    platformCount, themeCount, breakdown);
            return new MergeResult(view, analytics, issues, excluded);
        }
    }
}
