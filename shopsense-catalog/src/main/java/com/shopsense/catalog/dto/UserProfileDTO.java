package com.shopsense.catalog.dto;

import com.shopsense.catalog.entity.BehaviorStats;
import com.shopsense.catalog.entity.PersonalizationScores;
import com.shopsense.catalog.entity.User;
import com.shopsense.catalog.entity.UserPreference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read model of a shopper: preferences, personalization traits and behaviour
 * aggregates, flattened for the recommendation engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileDTO {

    private UUID id;
    private boolean active;

    // Preferences
    private BigDecimal minPricePreference;
    private BigDecimal maxPricePreference;
    private List<String> preferredCategories;
    private List<String> preferredBrands;

    // Personalization traits
    private double fashionStyle;
    private double priceConsciousness;
    private double brandLoyalty;
    private double trendFollower;
    private double qualityFocused;
    private double impulseBuyer;

    // Behaviour aggregates
    private int totalPurchases;
    private BigDecimal totalSpent;
    private BigDecimal averageOrderValue;
    private Map<Integer, Integer> hourlyClicks;
    private Map<Integer, Integer> weekdayClicks;

    public static UserProfileDTO fromEntity(User user) {
        PersonalizationScores scores = user.getPersonalizationScores() != null
                ? user.getPersonalizationScores()
                : new PersonalizationScores();
        BehaviorStats behavior = user.getBehavior() != null
                ? user.getBehavior()
                : new BehaviorStats();
        UserPreference preference = user.getPreference();

        return UserProfileDTO.builder()
                .id(user.getId())
                .active(Boolean.TRUE.equals(user.getEnabled()))
                .minPricePreference(preference != null ? preference.getMinPricePreference() : null)
                .maxPricePreference(preference != null ? preference.getMaxPricePreference() : null)
                .preferredCategories(preference != null ? List.copyOf(preference.getPreferredCategories()) : List.of())
                .preferredBrands(preference != null ? List.copyOf(preference.getPreferredBrands()) : List.of())
                .fashionStyle(scores.getFashionStyle())
                .priceConsciousness(scores.getPriceConsciousness())
                .brandLoyalty(scores.getBrandLoyalty())
                .trendFollower(scores.getTrendFollower())
                .qualityFocused(scores.getQualityFocused())
                .impulseBuyer(scores.getImpulseBuyer())
                .totalPurchases(behavior.getTotalPurchases())
                .totalSpent(behavior.getTotalSpent())
                .averageOrderValue(behavior.getAverageOrderValue())
                .hourlyClicks(Map.copyOf(user.getHourlyClicks()))
                .weekdayClicks(Map.copyOf(user.getWeekdayClicks()))
                .build();
    }
}
