package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.common.enums.Season;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.RecommendationCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Business-rule multipliers applied after merging:
 * preferred category x1.3, price inside the preferred range x1.2,
 * preferred brand x1.4, in-season product x1.1 (defaults).
 * Rules stack multiplicatively; a product matching none keeps its score.
 */
@Service
@RequiredArgsConstructor
public class PersonalizationBooster {

    private final RecommendationConfig config;

    /**
     * Boosts every candidate whose product is known and re-sorts the list.
     * Candidates without product details are left unboosted.
     */
    public List<RecommendationCandidate> apply(List<RecommendationCandidate> candidates,
                                               UserProfileDTO user,
                                               Map<UUID, ProductDTO> products,
                                               Season currentSeason) {
        return candidates.stream()
                .map(candidate -> {
                    ProductDTO product = products.get(candidate.productId());
                    return product != null
                            ? candidate.withBoost(boostFactor(product, user, currentSeason))
                            : candidate;
                })
                .sorted(HybridRanker.BY_SCORE_THEN_ID)
                .toList();
    }

    public double boostFactor(ProductDTO product, UserProfileDTO user, Season currentSeason) {
        RecommendationConfig.Boost boost = config.getBoost();
        double factor = 1.0;

        if (containsIgnoreCase(user.getPreferredCategories(), product.getCategory())) {
            factor *= boost.getCategory();
        }
        if (withinPriceRange(product.getPrice(), user)) {
            factor *= boost.getPrice();
        }
        if (containsIgnoreCase(user.getPreferredBrands(), product.getBrand())) {
            factor *= boost.getBrand();
        }
        if (inSeason(product, currentSeason)) {
            factor *= boost.getSeason();
        }
        return factor;
    }

    private boolean withinPriceRange(BigDecimal price, UserProfileDTO user) {
        if (price == null) {
            return false;
        }
        BigDecimal min = Objects.requireNonNullElse(user.getMinPricePreference(), config.getBoost().getDefaultMinPrice());
        BigDecimal max = Objects.requireNonNullElse(user.getMaxPricePreference(), config.getBoost().getDefaultMaxPrice());
        return price.compareTo(min) >= 0 && price.compareTo(max) <= 0;
    }

    private static boolean inSeason(ProductDTO product, Season currentSeason) {
        if (product.getSeasons() == null) {
            return false;
        }
        return product.getSeasons().stream()
                .map(Season::fromName)
                .anyMatch(season -> season.isPresent() && season.get() == currentSeason);
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        if (values == null || value == null) {
            return false;
        }
        return values.stream().anyMatch(value::equalsIgnoreCase);
    }
}
