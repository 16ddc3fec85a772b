package com.shopsense.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Engagement counters and derived scores kept on each product.
 * Counters are incremented by interaction tracking; ratings and the trending
 * score are maintained by their owning services.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class ProductAnalytics {

    @Column(name = "view_count", nullable = false)
    @Builder.Default
    private long viewCount = 0;

    @Column(name = "purchase_count", nullable = false)
    @Builder.Default
    private long purchaseCount = 0;

    @Column(name = "add_to_cart_count", nullable = false)
    @Builder.Default
    private long addToCartCount = 0;

    @Column(name = "add_to_wishlist_count", nullable = false)
    @Builder.Default
    private long addToWishlistCount = 0;

    /** Purchases per 100 views */
    @Column(name = "conversion_rate", nullable = false)
    @Builder.Default
    private double conversionRate = 0;

    @Column(name = "average_rating", nullable = false)
    @Builder.Default
    private double averageRating = 0;

    @Column(name = "total_reviews", nullable = false)
    @Builder.Default
    private int totalReviews = 0;

    @Column(name = "trending_score", nullable = false)
    @Builder.Default
    private double trendingScore = 0;
}
