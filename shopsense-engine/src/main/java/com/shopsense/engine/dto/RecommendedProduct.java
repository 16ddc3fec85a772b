package com.shopsense.engine.dto;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.model.RecommendationCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * A ranked product with why it was recommended.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendedProduct {

    private UUID productId;

    /** Product details; null when the catalog could not be read (fallback before lookup) */
    private ProductDTO product;

    private double score;

    /** Product of the personalization multipliers applied, 1 when none matched */
    private double boost;

    private List<RecommendationSource> sources;

    private String reason;

    public static RecommendedProduct fromCandidate(RecommendationCandidate candidate, ProductDTO product) {
        return RecommendedProduct.builder()
                .productId(candidate.productId())
                .product(product)
                .score(candidate.score())
                .boost(candidate.boost())
                .sources(List.copyOf(candidate.sources()))
                .reason(generateReason(candidate))
                .build();
    }

    private static String generateReason(RecommendationCandidate candidate) {
        if (candidate.sources().contains(RecommendationSource.COLLABORATIVE)) {
            return "Shoppers like you also chose this";
        }
        if (candidate.sources().contains(RecommendationSource.CONTENT_BASED)) {
            return "Matches your style";
        }
        if (candidate.sources().contains(RecommendationSource.TRENDING)) {
            return "Trending now";
        }
        return "Popular pick";
    }
}
