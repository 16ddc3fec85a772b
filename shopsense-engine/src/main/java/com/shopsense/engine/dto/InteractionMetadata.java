package com.shopsense.engine.dto;

import com.shopsense.common.enums.InteractionSource;

/**
 * Optional context of an interaction. Both fields may be null.
 */
public record InteractionMetadata(Integer durationSeconds, InteractionSource source) {

    public static InteractionMetadata none() {
        return new InteractionMetadata(null, null);
    }
}
