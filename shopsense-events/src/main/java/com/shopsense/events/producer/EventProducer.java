package com.shopsense.events.producer;

import com.shopsense.events.config.KafkaTopics;
import com.shopsense.events.dto.KafkaEvents.InteractionMessage;
import com.shopsense.events.dto.KafkaEvents.RecommendationsUpdatedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes engine events to Kafka. Sends are fire-and-forget: failures are
 * logged and never reach the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "shopsense.kafka.enabled", havingValue = "true")
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishInteraction(InteractionMessage message) {
        send(KafkaTopics.INTERACTION_EVENTS, message.getUserId(), message);
    }

    public void publishRecommendationsUpdated(RecommendationsUpdatedMessage message) {
        send(KafkaTopics.RECOMMENDATION_UPDATES, message.getUserId(), message);
    }

    private void send(String topic, String key, Object event) {
        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to send event to {}: {}", topic, e.getMessage());
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to send event to {}: {}", topic, ex.getMessage());
            } else {
                log.debug("Sent to {} partition {} offset {}",
                        topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
