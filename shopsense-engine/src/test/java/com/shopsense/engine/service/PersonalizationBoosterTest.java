package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.common.enums.Season;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.RecommendationCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.shopsense.engine.EngineFixtures.id;
import static com.shopsense.engine.EngineFixtures.product;
import static com.shopsense.engine.EngineFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PersonalizationBoosterTest {

    private final PersonalizationBooster booster = new PersonalizationBooster(new RecommendationConfig());

    private UserProfileDTO shopper;

    @BeforeEach
    void setUp() {
        shopper = user(id(1));
        shopper.setPreferredCategories(List.of("Dresses"));
        shopper.setPreferredBrands(List.of("Zara"));
        shopper.setMinPricePreference(new BigDecimal("20"));
        shopper.setMaxPricePreference(new BigDecimal("100"));
    }

    @Test
    void allRulesStackMultiplicatively() {
        ProductDTO dress = product(id(10));
        dress.setCategory("dresses");
        dress.setBrand("ZARA");
        dress.setPrice(new BigDecimal("59.99"));
        dress.setSeasons(List.of("Summer"));

        assertThat(booster.boostFactor(dress, shopper, Season.SUMMER)).isCloseTo(2.4024, within(1e-9));
    }

    @Test
    void productMatchingNothingKeepsItsScore() {
        ProductDTO coat = product(id(10));
        coat.setCategory("outerwear");
        coat.setBrand("Other");
        coat.setPrice(new BigDecimal("250"));
        coat.setSeasons(List.of("winter"));

        assertThat(booster.boostFactor(coat, shopper, Season.SUMMER)).isEqualTo(1.0);
    }

    @Test
    void priceBoundsAreInclusive() {
        ProductDTO atMin = product(id(10));
        atMin.setCategory("outerwear");
        atMin.setPrice(new BigDecimal("20.00"));
        ProductDTO atMax = product(id(11));
        atMax.setCategory("outerwear");
        atMax.setPrice(new BigDecimal("100"));
        ProductDTO above = product(id(12));
        above.setCategory("outerwear");
        above.setPrice(new BigDecimal("100.01"));

        assertThat(booster.boostFactor(atMin, shopper, Season.WINTER)).isCloseTo(1.2, within(1e-12));
        assertThat(booster.boostFactor(atMax, shopper, Season.WINTER)).isCloseTo(1.2, within(1e-12));
        assertThat(booster.boostFactor(above, shopper, Season.WINTER)).isEqualTo(1.0);
    }

    @Test
    void missingPricePreferencesUseDefaultRange() {
        UserProfileDTO newcomer = user(id(2));
        ProductDTO cheap = product(id(10));
        ProductDTO luxury = product(id(11));
        luxury.setPrice(new BigDecimal("12000"));

        assertThat(booster.boostFactor(cheap, newcomer, Season.WINTER)).isCloseTo(1.2, within(1e-12));
        assertThat(booster.boostFactor(luxury, newcomer, Season.WINTER)).isEqualTo(1.0);
    }

    @Test
    void autumnCountsAsFall() {
        UserProfileDTO newcomer = user(id(2));
        ProductDTO jacket = product(id(10));
        jacket.setPrice(null);
        jacket.setSeasons(List.of("Autumn"));

        assertThat(booster.boostFactor(jacket, newcomer, Season.FALL)).isCloseTo(1.1, within(1e-12));
    }

    @Test
    void applyReordersAndRecordsBoost() {
        UUID plain = id(10);
        UUID preferred = id(11);
        ProductDTO plainProduct = product(plain);
        plainProduct.setPrice(new BigDecimal("500"));
        ProductDTO preferredProduct = product(preferred);
        preferredProduct.setCategory("dresses");
        preferredProduct.setPrice(new BigDecimal("500"));

        List<RecommendationCandidate> boosted = booster.apply(
                List.of(RecommendationCandidate.of(plain, 0.5, RecommendationSource.TRENDING),
                        RecommendationCandidate.of(preferred, 0.4, RecommendationSource.TRENDING),
                        RecommendationCandidate.of(id(12), 0.45, RecommendationSource.TRENDING)),
                shopper,
                Map.of(plain, plainProduct, preferred, preferredProduct),
                Season.WINTER);

        assertThat(boosted).extracting(RecommendationCandidate::productId).containsExactly(preferred, plain, id(12));
        assertThat(boosted.get(0).score()).isCloseTo(0.52, within(1e-12));
        assertThat(boosted.get(0).boost()).isCloseTo(1.3, within(1e-12));
        assertThat(boosted.get(1).boost()).isEqualTo(1.0);
    }
}
