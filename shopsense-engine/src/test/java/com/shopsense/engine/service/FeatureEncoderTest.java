package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.engine.config.RecommendationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.shopsense.engine.EngineFixtures.product;
import static com.shopsense.engine.EngineFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureEncoderTest {

    private FeatureEncoder encoder;

    @BeforeEach
    void setUp() {
        RecommendationConfig config = new RecommendationConfig();
        config.getEncoder().setCategories(List.of("tops", "Dresses"));
        encoder = new FeatureEncoder(config);
    }

    @Test
    void userAndProductVectorsShareDimensionality() {
        assertThat(encoder.dimensions()).isEqualTo(15);
        assertThat(encoder.encodeProduct(product(UUID.randomUUID()))).hasSize(15);
        assertThat(encoder.encodeUser(user(UUID.randomUUID()))).hasSize(15);
    }

    @Test
    void encodesProductAttributes() {
        ProductDTO product = product(UUID.randomUUID());
        product.setPrice(new BigDecimal("250"));
        product.setViewCount(5000);
        product.setAverageRating(4);
        product.setCategory("dresses");
        product.setColors(List.of("red", "blue", "green"));
        product.setSizes(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11", "12"));
        product.setMaterials(List.of("linen"));
        product.setSeasons(List.of("summer", "Autumn", "monsoon"));
        product.setName("Premium linen dress");
        product.setDescription("Luxury summer dress on sale");

        double[] vector = encoder.encodeProduct(product);

        assertThat(vector).containsExactly(new double[]{
                0.25, 0.5, 0.8,       // price, popularity, rating
                0, 1,                 // tops, dresses
                0.3, 1.0, 0.2,        // colors, sizes (clamped), materials
                0, 1, 1, 0,           // spring, summer, fall, winter
                0.07, 0.2, 0.1        // words, quality terms, discount terms
        }, within(1e-12));
    }

    @Test
    void unknownCategoryAndMissingAttributesEncodeAsZero() {
        ProductDTO product = ProductDTO.builder().id(UUID.randomUUID()).category("garden").build();

        double[] vector = encoder.encodeProduct(product);

        assertThat(vector).containsOnly(0.0);
    }

    @Test
    void encodesUserProfile() {
        UserProfileDTO user = user(UUID.randomUUID());
        user.setMinPricePreference(new BigDecimal("100"));
        user.setMaxPricePreference(new BigDecimal("2500"));
        user.setFashionStyle(0.9);
        user.setPriceConsciousness(0.1);
        user.setBrandLoyalty(0.5);
        user.setTrendFollower(1.5);
        user.setQualityFocused(0.0);
        user.setImpulseBuyer(0.3);
        user.setTotalPurchases(25);
        user.setTotalSpent(new BigDecimal("2000"));
        user.setAverageOrderValue(new BigDecimal("80"));
        user.setPreferredCategories(List.of("TOPS", "garden"));
        user.setHourlyClicks(Map.of(9, 20, 20, 30));
        user.setWeekdayClicks(Map.of(1, 150));

        double[] vector = encoder.encodeUser(user);

        assertThat(vector).containsExactly(new double[]{
                0.1, 1.0,                          // min, max price (clamped)
                0.9, 0.1, 0.5, 1.0, 0.0, 0.3,      // personalization scores
                0.5, 0.2, 0.16,                    // purchases, spent, average order
                1, 0,                              // tops, dresses
                0.5, 1.0                           // hourly, weekday clicks
        }, within(1e-12));
    }

    @Test
    void encodingIsDeterministic() {
        ProductDTO product = product(UUID.randomUUID());
        product.setCategory("tops");

        assertThat(encoder.encodeProduct(product)).containsExactly(encoder.encodeProduct(product));
    }

    @Test
    void meaningfulWordsSkipStopWordsAndShortWords() {
        assertThat(FeatureEncoder.meaningfulWords("The cat and a dog with soft fur")).isEqualTo(4);
        assertThat(FeatureEncoder.meaningfulWords("")).isZero();
    }
}
