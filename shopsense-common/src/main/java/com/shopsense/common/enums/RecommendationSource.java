package com.shopsense.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Generators that can contribute a candidate to a recommendation list.
 */
public enum RecommendationSource {
    COLLABORATIVE("collaborative"),
    CONTENT_BASED("content-based"),
    TRENDING("trending"),
    FALLBACK("fallback");

    private final String value;

    RecommendationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
