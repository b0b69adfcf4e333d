package com.nayem.strata.validation;

import java.util.List;
import java.util.function.Function;

/**
 * Either a normalized typed document or the complete list of problems found
 * while reading it.
 *
 * @param <T> the document type
 */
public record ValidationResult<T>(T document, List<ValidationError> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (document == null && errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
    }

    public static <T> ValidationResult<T> valid(T document) {
        return new ValidationResult<>(document, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<ValidationError> errors) {
        return new ValidationResult<>(null, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Returns the document.
     *
     * @throws IllegalStateException if the result is invalid
     */
    public T value() {
        if (!isValid()) {
            throw new IllegalStateException("Document is invalid: " + errors);
        }
        return document;
    }

    /**
     * Keeps the document only if {@code check} reports no further errors.
     */
    public ValidationResult<T> andThen(Function<T, List<ValidationError>> check) {
        if (!isValid()) {
            return this;
        }
        List<ValidationError> more = check.apply(document);
        return more.isEmpty() ? this : invalid(more);
    }
}
