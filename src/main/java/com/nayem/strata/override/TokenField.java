package com.nayem.strata.override;

import com.nayem.strata.model.Token;

import java.util.Collection;
import java.util.function.Function;

/**
 * The token fields an override may carry. Identity is not among them.
 */
public enum TokenField {

    DISPLAY_NAME("displayName", Token::displayName),
    DESCRIPTION("description", Token::description),
    TOKEN_COLLECTION_ID("tokenCollectionId", Token::tokenCollectionId),
    RESOLVED_VALUE_TYPE_ID("resolvedValueTypeId", Token::resolvedValueTypeId),
    THEMEABLE("themeable", Token::themeable),
    PRIVATE("private", Token::isPrivate),
    STATUS("status", Token::status),
    TOKEN_TIER("tokenTier", Token::tokenTier),
    GENERATED_BY_ALGORITHM("generatedByAlgorithm", Token::generatedByAlgorithm),
    ALGORITHM_ID("algorithmId", Token::algorithmId),
    TAXONOMIES("taxonomies", Token::taxonomies),
    PROPERTY_TYPES("propertyTypes", Token::propertyTypes),
    CODE_SYNTAX("codeSyntax", Token::codeSyntax),
    VALUES_BY_MODE("valuesByMode", Token::valuesByMode);

    private final String fieldName;
    private final Function<Token, Object> accessor;

    TokenField(String fieldName, Function<Token, Object> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    public String fieldName() {
        return fieldName;
    }

    public Object read(Token token) {
        return accessor.apply(token);
    }

    /**
     * Whether a newly created token sets this field at all.
     */
    boolean isDefinedOn(Token token) {
        Object value = read(token);
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> values) {
            return !values.isEmpty();
        }
        return true;
    }
}
