package com.shopsense.engine.dto;

import com.shopsense.common.enums.InteractionSource;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductViewRequest {

    @NotNull(message = "userId is required")
    private UUID userId;

    @NotNull(message = "productId is required")
    private UUID productId;

    @PositiveOrZero(message = "durationSeconds must not be negative")
    private Integer durationSeconds;

    private InteractionSource source;

    public InteractionMetadata toMetadata() {
        return new InteractionMetadata(durationSeconds, source);
    }
}
