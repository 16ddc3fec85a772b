package com.shopsense.events.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outbound Kafka payloads, serialized as JSON.
 * Ids and enums travel as strings, timestamps as ISO-8601.
 *
 * Topics:
 * - interaction-events: InteractionMessage
 * - recommendation-updates: RecommendationsUpdatedMessage
 */
public class KafkaEvents {

    // ==================== INTERACTIONS (interaction-events topic) ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InteractionMessage {
        private String eventId;
        private String userId;
        private String productId;
        private String type;
        private String source;
        private Integer durationSeconds;
        private String timestamp;

        public static InteractionMessage fromEvent(InteractionEvent event) {
            return InteractionMessage.builder()
                    .eventId(event.getEventId())
                    .userId(event.getUserId().toString())
                    .productId(event.getProductId().toString())
                    .type(event.getType().toJson())
                    .source(event.getSource() != null ? event.getSource().toJson() : null)
                    .durationSeconds(event.getDurationSeconds())
                    .timestamp(event.getTimestamp().toString())
                    .build();
        }
    }

    // ==================== LIVE UPDATES (recommendation-updates topic) ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecommendationsUpdatedMessage {
        private String userId;
        private String triggerProductId;
        private Long modelGeneration;   // null when served from fallback before any model exists
        private Boolean fallback;
        private List<RecommendedItem> recommendations;
        private String timestamp;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecommendedItem {
        private String productId;
        private Double score;
        private List<String> sources;
    }
}
