package com.shopsense.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the recommendation engine.
 * Maps to shopsense.recommendation.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shopsense.recommendation")
public class RecommendationConfig {

    private Weights weights = new Weights();
    private Matrix matrix = new Matrix();
    private Collaborative collaborative = new Collaborative();
    private Boost boost = new Boost();
    private Scores scores = new Scores();
    private Refresh refresh = new Refresh();
    private Encoder encoder = new Encoder();

    /** Default page size for live (product-view) recommendations */
    private int liveLimit = 10;

    @Data
    public static class Weights {
        private double collaborative = 0.4;
        private double content = 0.4;
        private double trending = 0.2;
    }

    @Data
    public static class Matrix {
        /** Share of the cell score coming from recency */
        private double recencyWeight = 0.7;
        /** Share of the cell score coming from dwell time */
        private double durationWeight = 0.3;
        /** e-folding time of the recency decay */
        private double decayDays = 30;
        /** Dwell time above this many minutes counts as the cap */
        private double durationCapMinutes = 10;
    }

    @Data
    public static class Collaborative {
        /** Neighbours at or below this cosine similarity are ignored */
        private double similarityThreshold = 0.1;
        private int maxNeighbours = 10;
    }

    @Data
    public static class Boost {
        private double category = 1.3;
        private double price = 1.2;
        private double brand = 1.4;
        private double season = 1.1;
        /** Used when the user has no minimum price preference */
        private BigDecimal defaultMinPrice = BigDecimal.ZERO;
        /** Used when the user has no maximum price preference */
        private BigDecimal defaultMaxPrice = new BigDecimal("10000");
    }

    @Data
    public static class Scores {
        private double trending = 0.8;
        private double fallback = 0.5;
    }

    @Data
    public static class Refresh {
        /** Build a generation once the application is ready */
        private boolean onStartup = true;
        /** Events since the last successful refresh that make a refresh due */
        private long eventThreshold = 500;
        /** Time since the last attempt that makes a refresh due */
        private Duration interval = Duration.ofMinutes(15);
    }

    @Data
    public static class Encoder {
        /** Category vocabulary for the one-hot slots, matched case-insensitively */
        private List<String> categories = new ArrayList<>(List.of(
                "tops", "bottoms", "dresses", "outerwear", "shoes", "accessories", "activewear", "bags"));
    }
}
