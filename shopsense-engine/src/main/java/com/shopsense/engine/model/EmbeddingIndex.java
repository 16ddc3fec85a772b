package com.shopsense.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * User and product embeddings of one generation. All vectors share one
 * dimensionality so users and products are directly comparable.
 */
public final class EmbeddingIndex {

    private final int dimensions;
    private final Map<UUID, double[]> userVectors;
    private final Map<UUID, double[]> productVectors;

    public EmbeddingIndex(int dimensions, Map<UUID, double[]> userVectors, Map<UUID, double[]> productVectors) {
        this.dimensions = dimensions;
        this.userVectors = copy(userVectors, dimensions);
        this.productVectors = copy(productVectors, dimensions);
    }

    public static EmbeddingIndex empty(int dimensions) {
        return new EmbeddingIndex(dimensions, Map.of(), Map.of());
    }

    public int getDimensions() {
        return dimensions;
    }

    /** Returns a copy of the user's embedding. */
    public Optional<double[]> userVector(UUID userId) {
        return Optional.ofNullable(userVectors.get(userId)).map(double[]::clone);
    }

    /**
     * Cosine similarity between the user's embedding and every product embedding,
     * in product order. Empty when the user has no embedding.
     */
    public Map<UUID, Double> productSimilarities(UUID userId) {
        double[] user = userVectors.get(userId);
        if (user == null) {
            return Map.of();
        }
        Map<UUID, Double> similarities = new LinkedHashMap<>();
        productVectors.forEach((productId, vector) ->
                similarities.put(productId, VectorMath.cosineSimilarity(user, vector)));
        return similarities;
    }

    public int userCount() {
        return userVectors.size();
    }

    public int productCount() {
        return productVectors.size();
    }

    private static Map<UUID, double[]> copy(Map<UUID, double[]> vectors, int dimensions) {
        Map<UUID, double[]> copy = new LinkedHashMap<>();
        vectors.forEach((id, vector) -> {
            if (vector.length != dimensions) {
                throw new IllegalArgumentException("Embedding for " + id + " has " + vector.length
                        + " dimensions, expected " + dimensions);
            }
            copy.put(id, vector.clone());
        });
        return Collections.unmodifiableMap(copy);
    }
}
