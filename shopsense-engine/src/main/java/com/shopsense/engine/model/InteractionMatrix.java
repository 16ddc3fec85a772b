package com.shopsense.engine.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable user x product score matrix. Row i belongs to userIds[i] and
 * column j to productIds[j]; both id lists come from the same snapshot.
 */
public final class InteractionMatrix {

    private final List<UUID> userIds;
    private final List<UUID> productIds;
    private final double[][] scores;
    private final Map<UUID, Integer> userIndex;
    private final Map<UUID, Integer> productIndex;

    public InteractionMatrix(List<UUID> userIds, List<UUID> productIds, double[][] scores) {
        if (scores.length != userIds.size()) {
            throw new IllegalArgumentException("Row count " + scores.length + " does not match " + userIds.size() + " users");
        }
        this.userIds = List.copyOf(userIds);
        this.productIds = List.copyOf(productIds);
        this.scores = new double[scores.length][];
        for (int i = 0; i < scores.length; i++) {
            if (scores[i].length != productIds.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + scores[i].length
                        + " columns, expected " + productIds.size());
            }
            this.scores[i] = Arrays.copyOf(scores[i], scores[i].length);
        }
        this.userIndex = indexOf(this.userIds);
        this.productIndex = indexOf(this.productIds);
    }

    public static InteractionMatrix empty() {
        return new InteractionMatrix(List.of(), List.of(), new double[0][0]);
    }

    public List<UUID> getUserIds() {
        return userIds;
    }

    public List<UUID> getProductIds() {
        return productIds;
    }

    public int userCount() {
        return userIds.size();
    }

    public int productCount() {
        return productIds.size();
    }

    /** @return row index of the user, or -1 when the user has no row */
    public int rowOf(UUID userId) {
        return userIndex.getOrDefault(userId, -1);
    }

    /** @return column index of the product, or -1 when the product has no column */
    public int columnOf(UUID productId) {
        return productIndex.getOrDefault(productId, -1);
    }

    public double score(int row, int column) {
        return scores[row][column];
    }

    /** Returns a copy of the row; callers cannot change the matrix. */
    public double[] row(int row) {
        return Arrays.copyOf(scores[row], scores[row].length);
    }

    private static Map<UUID, Integer> indexOf(List<UUID> ids) {
        Map<UUID, Integer> index = new HashMap<>(ids.size() * 2);
        for (int i = 0; i < ids.size(); i++) {
            if (index.put(ids.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate id in matrix axis: " + ids.get(i));
            }
        }
        return index;
    }
}
