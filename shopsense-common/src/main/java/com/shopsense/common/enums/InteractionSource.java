package com.shopsense.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the interaction happened - how the user arrived at the product.
 */
public enum InteractionSource {
    SEARCH,
    RECOMMENDATION,
    CATEGORY,
    DIRECT,
    CART,
    HOME;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
