package com.shopsense.engine.service;

import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.model.RecommendationCandidate;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Merges candidate lists from several sources into one ranking.
 * A product's score is the weighted sum of its scores across sources and it
 * keeps every source that proposed it.
 */
@Service
public class HybridRanker {

    /** Score descending, productId ascending on ties. */
    public static final Comparator<RecommendationCandidate> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(RecommendationCandidate::score).reversed()
                    .thenComparing(RecommendationCandidate::productId);

    public record WeightedCandidates(List<RecommendationCandidate> candidates, double weight) {}

    public List<RecommendationCandidate> combine(List<WeightedCandidates> inputs) {
        Map<UUID, Double> scores = new LinkedHashMap<>();
        Map<UUID, Set<RecommendationSource>> sources = new LinkedHashMap<>();

        for (WeightedCandidates input : inputs) {
            for (RecommendationCandidate candidate : input.candidates()) {
                scores.merge(candidate.productId(), candidate.score() * input.weight(), Double::sum);
                sources.computeIfAbsent(candidate.productId(), id -> EnumSet.noneOf(RecommendationSource.class))
                        .addAll(candidate.sources());
            }
        }

        return scores.entrySet().stream()
                .map(entry -> new RecommendationCandidate(
                        entry.getKey(), entry.getValue(), sources.get(entry.getKey()), 1.0))
                .sorted(BY_SCORE_THEN_ID)
                .toList();
    }
}
