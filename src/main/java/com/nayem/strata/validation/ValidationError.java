package com.nayem.strata.validation;

/**
 * One field-level problem of a non-conforming document.
 *
 * @param code    a stable, dotted identifier such as {@code field.required}
 * @param path    the location of the field, e.g. {@code tokens[2].valuesByMode[0].modeIds}
 * @param message a human readable description
 */
public record ValidationError(String code, String path, String message) implements Problem {

    @Override
    public String toString() {
        return code + " at " + path + ": " + message;
    }
}
