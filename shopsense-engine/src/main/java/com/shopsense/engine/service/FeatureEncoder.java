package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.common.enums.Season;
import com.shopsense.engine.config.RecommendationConfig;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.shopsense.engine.model.VectorMath.clamp;

/**
 * Turns products and users into fixed-length vectors in [0,1].
 *
 * Both vectors have {@code 13 + K} slots, K being the size of the category
 * vocabulary, so user and product embeddings can be compared directly.
 *
 * Product layout: price, popularity, rating, category one-hot (K),
 * colors, sizes, materials, spring, summer, fall, winter, word count,
 * quality terms, discount terms.
 *
 * User layout: min price, max price, the six personalization scores,
 * purchases, total spent, average order value, preferred-category one-hot (K),
 * hourly clicks, weekday clicks.
 */
@Service
public class FeatureEncoder {

    static final int FIXED_SLOTS = 13;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");
    private static final Pattern QUALITY_TERMS =
            Pattern.compile("\\b(premium|luxury|high-quality)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISCOUNT_TERMS =
            Pattern.compile("\\b(sale|discount|cheap|affordable)\\b", Pattern.CASE_INSENSITIVE);

    private final List<String> vocabulary;
    private final Map<String, Integer> categoryIndex;

    public FeatureEncoder(RecommendationConfig config) {
        this.vocabulary = config.getEncoder().getCategories().stream()
                .map(FeatureEncoder::normalize)
                .distinct()
                .toList();
        this.categoryIndex = new HashMap<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            categoryIndex.put(vocabulary.get(i), i);
        }
    }

    public int dimensions() {
        return FIXED_SLOTS + vocabulary.size();
    }

    public double[] encodeProduct(ProductDTO product) {
        double[] vector = new double[dimensions()];
        int i = 0;

        vector[i++] = clamp(toDouble(product.getPrice()) / 1000);
        vector[i++] = clamp(product.getViewCount() / 10000.0);
        vector[i++] = clamp(product.getAverageRating() / 5);

        Integer category = product.getCategory() != null ? categoryIndex.get(normalize(product.getCategory())) : null;
        if (category != null) {
            vector[i + category] = 1;
        }
        i += vocabulary.size();

        vector[i++] = clamp(size(product.getColors()) / 10.0);
        vector[i++] = clamp(size(product.getSizes()) / 10.0);
        vector[i++] = clamp(size(product.getMaterials()) / 5.0);

        int seasonStart = i;
        if (product.getSeasons() != null) {
            for (String name : product.getSeasons()) {
                Season.fromName(name).ifPresent(season -> vector[seasonStart + season.ordinal()] = 1);
            }
        }
        i += Season.values().length;

        String text = (nullToEmpty(product.getName()) + " " + nullToEmpty(product.getDescription())).trim();
        vector[i++] = clamp(meaningfulWords(text) / 100.0);
        vector[i++] = clamp(count(QUALITY_TERMS, text) / 10.0);
        vector[i] = clamp(count(DISCOUNT_TERMS, text) / 10.0);

        return vector;
    }

    public double[] encodeUser(UserProfileDTO user) {
        double[] vector = new double[dimensions()];
        int i = 0;

        vector[i++] = clamp(toDouble(user.getMinPricePreference()) / 1000);
        vector[i++] = clamp(toDouble(user.getMaxPricePreference()) / 1000);

        vector[i++] = clamp(user.getFashionStyle());
        vector[i++] = clamp(user.getPriceConsciousness());
        vector[i++] = clamp(user.getBrandLoyalty());
        vector[i++] = clamp(user.getTrendFollower());
        vector[i++] = clamp(user.getQualityFocused());
        vector[i++] = clamp(user.getImpulseBuyer());

        vector[i++] = clamp(user.getTotalPurchases() / 50.0);
        vector[i++] = clamp(toDouble(user.getTotalSpent()) / 10000);
        vector[i++] = clamp(toDouble(user.getAverageOrderValue()) / 500);

        if (user.getPreferredCategories() != null) {
            for (String name : user.getPreferredCategories()) {
                Integer category = name != null ? categoryIndex.get(normalize(name)) : null;
                if (category != null) {
                    vector[i + category] = 1;
                }
            }
        }
        i += vocabulary.size();

        vector[i++] = clamp(sum(user.getHourlyClicks()) / 100.0);
        vector[i] = clamp(sum(user.getWeekdayClicks()) / 100.0);

        return vector;
    }

    static int meaningfulWords(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                count++;
            }
        }
        return count;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    private static double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : 0;
    }

    private static int size(Collection<?> values) {
        return values != null ? values.size() : 0;
    }

    private static long sum(Map<Integer, Integer> clicks) {
        if (clicks == null) {
            return 0;
        }
        return clicks.values().stream()
                .filter(Objects::nonNull)
                .mapToLong(Integer::longValue)
                .sum();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
