package com.shopsense.engine.service;

import com.shopsense.catalog.exception.CatalogException;
import com.shopsense.catalog.service.ProductService;
import com.shopsense.common.enums.InteractionType;
import com.shopsense.engine.dto.InteractionMetadata;
import com.shopsense.engine.dto.TrackInteractionResponse;
import com.shopsense.events.dto.InteractionEvent;
import com.shopsense.events.dto.KafkaEvents.InteractionMessage;
import com.shopsense.events.producer.EventProducer;
import com.shopsense.events.store.InteractionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Write path: appends an interaction to the store, then bumps the product's
 * analytics counter, publishes the event and starts a model refresh when one is due.
 * The counter is only touched once the event is stored.
 * Failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class InteractionTracker {

    private final InteractionStore interactionStore;
    private final ProductService productService;
    private final ModelRefreshService modelRefreshService;
    @Nullable
    private final EventProducer eventProducer;
    private final Clock clock;

    public InteractionTracker(InteractionStore interactionStore,
                              ProductService productService,
                              ModelRefreshService modelRefreshService,
                              @Autowired(required = false) @Nullable EventProducer eventProducer,
                              Clock clock) {
        this.interactionStore = interactionStore;
        this.productService = productService;
        this.modelRefreshService = modelRefreshService;
        this.eventProducer = eventProducer;
        this.clock = clock;

        if (eventProducer == null) {
            log.info("Kafka disabled - tracked interactions will not be published");
        }
    }

    public TrackInteractionResponse track(UUID userId, UUID productId, InteractionType type, InteractionMetadata metadata) {
        InteractionMetadata context = metadata != null ? metadata : InteractionMetadata.none();
        InteractionEvent event = InteractionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .userId(userId)
                .productId(productId)
                .type(type)
                .timestamp(clock.instant())
                .durationSeconds(context.durationSeconds())
                .source(context.source())
                .build();

        try {
            interactionStore.append(event);
            productService.recordInteraction(productId, type);
        } catch (CatalogException e) {
            log.warn("Ignoring {} for userId={}: {}", type.toJson(), userId, e.getMessage());
            return TrackInteractionResponse.ignored();
        } catch (Exception e) {
            log.warn("Failed to track {} for userId={}, productId={}: {}",
                    type.toJson(), userId, productId, e.getMessage());
            return TrackInteractionResponse.ignored();
        }

        log.debug("Tracked {} userId={}, productId={}, eventId={}",
                type.toJson(), userId, productId, event.getEventId());

        publish(event);
        maybeRefresh();

        return TrackInteractionResponse.tracked(event.getEventId());
    }

    private void publish(InteractionEvent event) {
        if (eventProducer == null) {
            return;
        }
        try {
            eventProducer.publishInteraction(InteractionMessage.fromEvent(event));
        } catch (Exception e) {
            log.warn("Failed to publish interaction {}: {}", event.getEventId(), e.getMessage());
        }
    }

    private void maybeRefresh() {
        try {
            if (modelRefreshService.recordEvent()) {
                log.info("Model refresh due, starting in background");
                modelRefreshService.refreshAsync();
            }
        } catch (Exception e) {
            log.warn("Failed to start model refresh: {}", e.getMessage());
        }
    }
}
