package com.shopsense.engine.service;

import com.shopsense.common.enums.RecommendationSource;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.InteractionMatrix;
import com.shopsense.engine.model.RecommendationCandidate;
import com.shopsense.engine.model.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * User-based collaborative filtering over the interaction matrix.
 *
 * Neighbours are the most similar rows by cosine similarity above the
 * threshold. A product the target user has not touched scores the sum of
 * {@code neighbourCell * similarity} over the neighbours that touched it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollaborativeFilter {

    private final RecommendationConfig config;

    public List<RecommendationCandidate> recommend(UUID userId, InteractionMatrix matrix, int limit) {
        int target = matrix.rowOf(userId);
        if (target < 0 || limit <= 0) {
            return List.of();
        }

        double[] targetRow = matrix.row(target);
        List<Neighbour> neighbours = findNeighbours(target, targetRow, matrix);
        if (neighbours.isEmpty()) {
            log.debug("No neighbours for userId={}", userId);
            return List.of();
        }

        double[] accumulated = new double[matrix.productCount()];
        for (Neighbour neighbour : neighbours) {
            for (int column = 0; column < accumulated.length; column++) {
                double cell = matrix.score(neighbour.row(), column);
                if (targetRow[column] == 0 && cell > 0) {
                    accumulated[column] += cell * neighbour.similarity();
                }
            }
        }

        List<RecommendationCandidate> candidates = new ArrayList<>();
        for (int column = 0; column < accumulated.length; column++) {
            if (accumulated[column] > 0) {
                candidates.add(RecommendationCandidate.of(
                        matrix.getProductIds().get(column), accumulated[column], RecommendationSource.COLLABORATIVE));
            }
        }

        log.debug("Collaborative candidates for userId={}: neighbours={}, candidates={}",
                userId, neighbours.size(), candidates.size());
        return candidates.stream()
                .sorted(HybridRanker.BY_SCORE_THEN_ID)
                .limit(limit)
                .toList();
    }

    private List<Neighbour> findNeighbours(int target, double[] targetRow, InteractionMatrix matrix) {
        RecommendationConfig.Collaborative settings = config.getCollaborative();
        List<Neighbour> neighbours = new ArrayList<>();
        for (int row = 0; row < matrix.userCount(); row++) {
            if (row == target) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(targetRow, matrix.row(row));
            if (similarity > settings.getSimilarityThreshold()) {
                neighbours.add(new Neighbour(row, similarity));
            }
        }
        return neighbours.stream()
                .sorted(Comparator.comparingDouble(Neighbour::similarity).reversed()
                        .thenComparingInt(Neighbour::row))
                .limit(settings.getMaxNeighbours())
                .toList();
    }

    private record Neighbour(int row, double similarity) {}
}
