package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.service.ProductService;
import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.exception.RecommendationException;
import com.shopsense.engine.model.RecommendationCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Popularity-based candidates: trending products for every request and
 * featured products as the cold-start fallback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendingService {

    private final ProductService productService;
    private final RecommendationConfig config;

    /**
     * @throws RecommendationException LOOKUP_FAILED when the catalog cannot be read
     */
    public List<RecommendationCandidate> trending(int limit) {
        List<ProductDTO> products;
        try {
            products = productService.getTrendingProducts(limit);
        } catch (RuntimeException e) {
            throw RecommendationException.lookupFailed("trending products", e);
        }
        double score = config.getScores().getTrending();
        return products.stream()
                .map(product -> RecommendationCandidate.of(product.getId(), score, RecommendationSource.TRENDING))
                .toList();
    }

    /**
     * Featured products by views. Never throws: a failing lookup yields an empty list.
     */
    public List<ProductDTO> fallbackProducts(int limit) {
        try {
            return productService.getFeaturedProducts(limit);
        } catch (RuntimeException e) {
            log.error("Fallback lookup failed: {}", e.getMessage(), e);
            return List.of();
        }
    }

    public RecommendationCandidate toFallbackCandidate(ProductDTO product) {
        return RecommendationCandidate.of(product.getId(), config.getScores().getFallback(), RecommendationSource.FALLBACK);
    }
}
