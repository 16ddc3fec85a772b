package com.shopsense.events.config;

/**
 * Kafka topic names for ShopSense.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    /** Every tracked interaction, keyed by userId */
    public static final String INTERACTION_EVENTS = "interaction-events";

    /** Freshly computed recommendations for the real-time layer to push to the user's session */
    public static final String RECOMMENDATION_UPDATES = "recommendation-updates";
}
