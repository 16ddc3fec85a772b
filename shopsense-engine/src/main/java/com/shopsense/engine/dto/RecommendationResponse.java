package com.shopsense.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Ranked recommendations for one user plus how they were produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    /** User ID (null for anonymous requests) */
    private String userId;

    private List<RecommendedProduct> recommendations;

    private int totalCount;

    /** True when collaborative or content signals contributed */
    private boolean personalized;

    /** True when the cold-start defaults were served instead of the pipeline */
    private boolean fallback;

    /** Model generation used; null when none was available */
    private Long modelGeneration;

    /** Source name -> number of returned products carrying that source */
    private Map<String, Integer> sources;

    private long processingTimeMs;

    private String generatedAt;
}
