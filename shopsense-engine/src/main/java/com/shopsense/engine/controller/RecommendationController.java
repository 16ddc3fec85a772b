package com.shopsense.engine.controller;

import com.shopsense.engine.dto.RecommendationResponse;
import com.shopsense.engine.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Personalized recommendations for the current user.
 */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
@Slf4j
public class RecommendationController {

    static final int MAX_LIMIT = 50;

    private final RecommendationService recommendationService;

    /**
     * @param userId User ID from header (optional - if absent, returns popular products)
     * @param limit Maximum number of recommendations (default: 10, max: 50)
     * @param excludeRecentlyViewed Drop products the user viewed recently (default: true)
     */
    @GetMapping
    public ResponseEntity<RecommendationResponse> getRecommendations(
            @RequestHeader(value = "X-User-Id", required = false) UUID userId,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "true") boolean excludeRecentlyViewed) {

        log.info("GET /api/recommendations - userId={}, limit={}", userId, limit);

        limit = Math.max(1, Math.min(limit, MAX_LIMIT));

        RecommendationResponse response =
                recommendationService.getRecommendations(userId, limit, excludeRecentlyViewed);

        log.info("Returning {} recommendations for userId={}, personalized={}, fallback={}, processingTimeMs={}",
                response.getTotalCount(), userId, response.isPersonalized(), response.isFallback(),
                response.getProcessingTimeMs());

        return ResponseEntity.ok(response);
    }
}
