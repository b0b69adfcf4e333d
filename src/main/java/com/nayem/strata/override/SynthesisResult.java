package com.nayem.strata.override;

import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.validation.Problem;

import java.util.List;

/**
 * The outcome of synthesizing an override.
 * <p>
 * A successful result with a {@code null} payload means there is nothing to
 * persist, which is not an error.
 * </p>
 *
 * @param payload       the override document fragment, or {@code null}
 * @param changedFields the fields the edit changed
 * @param problem       why synthesis failed, {@code null} on success
 */
public record SynthesisResult(SourceDocument payload, List<TokenField> changedFields, Problem problem) {

    public SynthesisResult {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }

    public static SynthesisResult success(SourceDocument payload, List<TokenField> changedFields) {
        return new SynthesisResult(payload, changedFields, null);
    }

    public static SynthesisResult nothingToPersist() {
        return new SynthesisResult(null, List.of(), null);
    }

    public static SynthesisResult failure(Problem problem) {
        return new SynthesisResult(null, List.of(), problem);
    }

    public boolean isSuccess() {
        return problem == null;
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
