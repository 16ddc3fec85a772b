package com.shopsense.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of user/product interactions the engine learns from.
 */
public enum InteractionType {
    VIEW,
    PURCHASE,
    ADD_TO_CART,
    ADD_TO_WISHLIST;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
