package com.shopsense.events.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.shopsense.common.enums.InteractionSource;
import com.shopsense.common.enums.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A single user/product interaction as kept in the interaction store.
 * Events are append-only; the store keeps the most recent ones per user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionEvent {
    private String eventId;
    private UUID userId;
    private UUID productId;
    private InteractionType type;
    private Instant timestamp;
    private Integer durationSeconds;   // null when unknown
    private InteractionSource source;  // null when unknown

    @JsonIgnore
    public boolean isView() {
        return type == InteractionType.VIEW;
    }
}
