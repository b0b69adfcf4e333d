package com.nayem.strata.validation;

/**
 * Something wrong with a source document. Validation errors describe documents
 * that do not conform to their format; policy violations describe documents
 * that conform but ask for something a business rule forbids.
 */
public sealed interface Problem permits ValidationError, PolicyViolation {

    String message();
}
