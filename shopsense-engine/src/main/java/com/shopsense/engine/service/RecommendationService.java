package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.catalog.service.ProductService;
import com.shopsense.catalog.service.UserProfileService;
import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.common.enums.Season;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.dto.RecommendationResponse;
import com.shopsense.engine.dto.RecommendedProduct;
import com.shopsense.engine.exception.RecommendationException;
import com.shopsense.engine.model.ModelGeneration;
import com.shopsense.engine.model.ModelHandle;
import com.shopsense.engine.model.RecommendationCandidate;
import com.shopsense.engine.service.HybridRanker.WeightedCandidates;
import com.shopsense.events.store.InteractionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Request path of the engine.
 *
 * Pipeline:
 * 1. Resolve the current model generation
 * 2. Collaborative and content candidates (2 x limit each), trending (limit)
 * 3. Weighted merge
 * 4. Drop recently viewed products (optional)
 * 5. Personalization boosts, re-sort
 * 6. Truncate to limit
 *
 * An empty pipeline result or any failure serves the featured fallback
 * instead; callers never see an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final ModelHandle modelHandle;
    private final CollaborativeFilter collaborativeFilter;
    private final ContentFilter contentFilter;
    private final TrendingService trendingService;
    private final HybridRanker hybridRanker;
    private final PersonalizationBooster personalizationBooster;
    private final InteractionStore interactionStore;
    private final ProductService productService;
    private final UserProfileService userProfileService;
    private final RecommendationConfig config;
    private final Clock clock;

    /**
     * @param userId user to recommend for; null for anonymous requests
     * @param limit  maximum number of recommendations, at least 1
     */
    public RecommendationResponse getRecommendations(UUID userId, int limit, boolean excludeRecentlyViewed) {
        long startTime = System.currentTimeMillis();
        log.debug("Getting recommendations for userId={}, limit={}, excludeRecentlyViewed={}",
                userId, limit, excludeRecentlyViewed);

        RecommendationResponse response;
        try {
            response = runPipeline(userId, limit, excludeRecentlyViewed);
            if (response.getRecommendations().isEmpty()) {
                log.info("Pipeline produced no recommendations for userId={}, serving fallback", userId);
                response = fallback(userId, limit);
            }
        } catch (RecommendationException e) {
            log.warn("Recommendations degraded to fallback for userId={}: {} ({})",
                    userId, e.getMessage(), e.getErrorCode());
            response = fallback(userId, limit);
        } catch (Exception e) {
            log.warn("Recommendation pipeline failed for userId={}, serving fallback: {}",
                    userId, e.getMessage(), e);
            response = fallback(userId, limit);
        }

        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        return response;
    }

    private RecommendationResponse runPipeline(UUID userId, int limit, boolean excludeRecentlyViewed) {
        ModelGeneration generation = modelHandle.current();
        RecommendationConfig.Weights weights = config.getWeights();

        List<RecommendationCandidate> collaborative = userId != null
                ? collaborativeFilter.recommend(userId, generation.matrix(), limit * 2)
                : List.of();
        List<RecommendationCandidate> content = userId != null
                ? contentFilter.recommend(userId, generation.embeddings(), limit * 2)
                : List.of();
        List<RecommendationCandidate> trending = trendingService.trending(limit);

        List<RecommendationCandidate> ranked = hybridRanker.combine(List.of(
                new WeightedCandidates(collaborative, weights.getCollaborative()),
                new WeightedCandidates(content, weights.getContent()),
                new WeightedCandidates(trending, weights.getTrending())));

        if (excludeRecentlyViewed && userId != null) {
            Set<UUID> viewed = interactionStore.recentlyViewed(userId);
            ranked = ranked.stream()
                    .filter(candidate -> !viewed.contains(candidate.productId()))
                    .toList();
        }

        Map<UUID, ProductDTO> products = lookupProducts(ranked);
        ranked = ranked.stream()
                .filter(candidate -> {
                    ProductDTO product = products.get(candidate.productId());
                    return product != null && product.isActive();
                })
                .toList();

        Optional<UserProfileDTO> profile = userId != null ? userProfileService.findProfile(userId) : Optional.empty();
        if (profile.isPresent()) {
            Season season = Season.of(LocalDate.now(clock).getMonth());
            ranked = personalizationBooster.apply(ranked, profile.get(), products, season);
        }

        List<RecommendationCandidate> top = ranked.stream().limit(limit).toList();
        boolean personalized = top.stream().anyMatch(candidate ->
                candidate.sources().contains(RecommendationSource.COLLABORATIVE)
                        || candidate.sources().contains(RecommendationSource.CONTENT_BASED));

        log.debug("Pipeline for userId={}: collaborative={}, content={}, trending={}, returned={}",
                userId, collaborative.size(), content.size(), trending.size(), top.size());

        return buildResponse(userId, top, products, personalized, false, generation.generation());
    }

    /**
     * Featured products by views. Used when the pipeline fails or returns nothing.
     */
    public RecommendationResponse fallback(UUID userId, int limit) {
        List<ProductDTO> featured = trendingService.fallbackProducts(limit);
        Map<UUID, ProductDTO> products = new LinkedHashMap<>();
        featured.forEach(product -> products.put(product.getId(), product));

        List<RecommendationCandidate> candidates = featured.stream()
                .map(trendingService::toFallbackCandidate)
                .toList();

        Long generation = modelHandle.find().map(ModelGeneration::generation).orElse(null);
        return buildResponse(userId, candidates, products, false, true, generation);
    }

    private Map<UUID, ProductDTO> lookupProducts(List<RecommendationCandidate> candidates) {
        try {
            return productService.getProductsByIds(
                    candidates.stream().map(RecommendationCandidate::productId).toList());
        } catch (RuntimeException e) {
            throw RecommendationException.lookupFailed("candidate products", e);
        }
    }

    private RecommendationResponse buildResponse(UUID userId,
                                                 List<RecommendationCandidate> candidates,
                                                 Map<UUID, ProductDTO> products,
                                                 boolean personalized,
                                                 boolean fallback,
                                                 Long generation) {
        List<RecommendedProduct> recommendations = candidates.stream()
                .map(candidate -> RecommendedProduct.fromCandidate(candidate, products.get(candidate.productId())))
                .toList();

        Map<String, Integer> sourceCounts = new LinkedHashMap<>();
        for (RecommendationCandidate candidate : candidates) {
            for (RecommendationSource source : candidate.sources()) {
                sourceCounts.merge(source.getValue(), 1, Integer::sum);
            }
        }

        return RecommendationResponse.builder()
                .userId(userId != null ? userId.toString() : null)
                .recommendations(recommendations)
                .totalCount(recommendations.size())
                .personalized(personalized)
                .fallback(fallback)
                .modelGeneration(generation)
                .sources(sourceCounts)
                .generatedAt(Instant.now(clock).toString())
                .build();
    }
}
