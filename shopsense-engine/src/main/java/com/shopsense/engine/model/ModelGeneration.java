package com.shopsense.engine.model;

import java.time.Instant;

/**
 * One published version of the model. Built off to the side and swapped in
 * as a whole, so readers see either the old or the new generation.
 */
public record ModelGeneration(
        long generation,
        Instant builtAt,
        InteractionMatrix matrix,
        EmbeddingIndex embeddings,
        long eventCount
) {
}
