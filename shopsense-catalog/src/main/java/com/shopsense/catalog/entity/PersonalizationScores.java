package com.shopsense.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Shopper traits in [0,1], maintained by the profiling pipeline.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class PersonalizationScores {

    @Column(name = "fashion_style", nullable = false)
    @Builder.Default
    private double fashionStyle = 0;

    @Column(name = "price_consciousness", nullable = false)
    @Builder.Default
    private double priceConsciousness = 0;

    @Column(name = "brand_loyalty", nullable = false)
    @Builder.Default
    private double brandLoyalty = 0;

    @Column(name = "trend_follower", nullable = false)
    @Builder.Default
    private double trendFollower = 0;

    @Column(name = "quality_focused", nullable = false)
    @Builder.Default
    private double qualityFocused = 0;

    @Column(name = "impulse_buyer", nullable = false)
    @Builder.Default
    private double impulseBuyer = 0;
}
