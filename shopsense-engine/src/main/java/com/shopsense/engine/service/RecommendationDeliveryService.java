package com.shopsense.engine.service;

import com.shopsense.common.enums.InteractionType;
import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.dto.InteractionMetadata;
import com.shopsense.engine.dto.RecommendationResponse;
import com.shopsense.events.dto.KafkaEvents.RecommendationsUpdatedMessage;
import com.shopsense.events.dto.KafkaEvents.RecommendedItem;
import com.shopsense.events.producer.EventProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Live path for product views: track the view, recompute the user's
 * recommendations and hand them to the real-time layer over Kafka.
 */
@Slf4j
@Service
public class RecommendationDeliveryService {

    private final InteractionTracker interactionTracker;
    private final RecommendationService recommendationService;
    private final RecommendationConfig config;
    @Nullable
    private final EventProducer eventProducer;

    public RecommendationDeliveryService(InteractionTracker interactionTracker,
                                         RecommendationService recommendationService,
                                         RecommendationConfig config,
                                         @Autowired(required = false) @Nullable EventProducer eventProducer) {
        this.interactionTracker = interactionTracker;
        this.recommendationService = recommendationService;
        this.config = config;
        this.eventProducer = eventProducer;
    }

    public RecommendationResponse onProductViewed(UUID userId, UUID productId, InteractionMetadata metadata) {
        interactionTracker.track(userId, productId, InteractionType.VIEW, metadata);

        RecommendationResponse response = recommendationService.getRecommendations(userId, config.getLiveLimit(), true);
        log.info("Recomputed {} recommendations for userId={} after view of productId={}",
                response.getTotalCount(), userId, productId);

        if (eventProducer != null) {
            try {
                eventProducer.publishRecommendationsUpdated(toMessage(userId, productId, response));
            } catch (Exception e) {
                log.warn("Failed to publish recommendation update for userId={}: {}", userId, e.getMessage());
            }
        }
        return response;
    }

    private static RecommendationsUpdatedMessage toMessage(UUID userId, UUID productId, RecommendationResponse response) {
        List<RecommendedItem> items = response.getRecommendations().stream()
                .map(recommendation -> RecommendedItem.builder()
                        .productId(recommendation.getProductId().toString())
                        .score(recommendation.getScore())
                        .sources(recommendation.getSources().stream().map(RecommendationSource::getValue).toList())
                        .build())
                .toList();

        return RecommendationsUpdatedMessage.builder()
                .userId(userId.toString())
                .triggerProductId(productId.toString())
                .modelGeneration(response.getModelGeneration())
                .fallback(response.isFallback())
                .recommendations(items)
                .timestamp(response.getGeneratedAt())
                .build();
    }
}
