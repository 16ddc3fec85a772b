package com.shopsense.engine.model;

import com.shopsense.common.enums.RecommendationSource;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * A scored product suggestion together with the sources that produced it.
 * boost is the product of the personalization multipliers applied (1 when none).
 */
public record RecommendationCandidate(
        UUID productId,
        double score,
        Set<RecommendationSource> sources,
        double boost
) {
    public RecommendationCandidate {
        sources = Collections.unmodifiableSet(sources.isEmpty()
                ? EnumSet.noneOf(RecommendationSource.class)
                : EnumSet.copyOf(sources));
    }

    public static RecommendationCandidate of(UUID productId, double score, RecommendationSource source) {
        return new RecommendationCandidate(productId, score, EnumSet.of(source), 1.0);
    }

    public RecommendationCandidate withBoost(double factor) {
        return new RecommendationCandidate(productId, score * factor, sources, boost * factor);
    }
}
