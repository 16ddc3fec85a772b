package com.shopsense.engine.service;

import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.model.EmbeddingIndex;
import com.shopsense.engine.model.RecommendationCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ranks products by cosine similarity between their embedding and the user's.
 */
@Slf4j
@Service
public class ContentFilter {

    public List<RecommendationCandidate> recommend(UUID userId, EmbeddingIndex embeddings, int limit) {
        Map<UUID, Double> similarities = embeddings.productSimilarities(userId);
        if (similarities.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<RecommendationCandidate> candidates = similarities.entrySet().stream()
                .map(entry -> RecommendationCandidate.of(
                        entry.getKey(),
                        entry.getValue(),
                        RecommendationSource.CONTENT_BASED))
                .sorted(HybridRanker.BY_SCORE_THEN_ID)
                .limit(limit)
                .toList();

        log.debug("Content candidates for userId={}: {}", userId, candidates.size());
        return candidates;
    }
}
