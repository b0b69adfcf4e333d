package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * The value held by a token for one mode combination: either a literal JSON
 * value ({@code {"value": ...}}) or an alias to another token
 * ({@code {"tokenId": "..."}}).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
        @JsonSubTypes.Type(TokenValue.Literal.class),
        @JsonSubTypes.Type(TokenValue.Alias.class)
})
public sealed interface TokenValue permits TokenValue.Literal, TokenValue.Alias {

    static TokenValue literal(JsonNode value) {
        return new Literal(value);
    }

    static TokenValue alias(String tokenId) {
        return new Alias(tokenId);
    }

    record Literal(JsonNode value) implements TokenValue {
        public Literal {
            value = value == null ? NullNode.getInstance() : value;
        }
    }

    record Alias(String tokenId) implements TokenValue {
        public Alias {
            Objects.requireNonNull(tokenId, "tokenId");
        }
    }
}
