package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.InteractionMatrix;
import com.shopsense.events.dto.InteractionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the dense user x product matrix from interaction histories.
 *
 * A cell keeps the strongest signal among the user's events for that product,
 * where an event scores {@code recency * 0.7 + duration * 0.3} by default:
 * recency decays as {@code exp(-days / 30)} and duration is dwell time in
 * minutes capped at 10, scaled to [0,1].
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractionMatrixBuilder {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final RecommendationConfig config;

    public InteractionMatrix build(List<UserProfileDTO> users,
                                   List<ProductDTO> products,
                                   Map<UUID, List<InteractionEvent>> eventsByUser,
                                   Instant now) {
        List<UUID> userIds = users.stream()
                .filter(UserProfileDTO::isActive)
                .map(UserProfileDTO::getId)
                .distinct()
                .sorted(Comparator.naturalOrder())
                .toList();
        List<UUID> productIds = products.stream()
                .filter(ProductDTO::isActive)
                .map(ProductDTO::getId)
                .distinct()
                .sorted(Comparator.naturalOrder())
                .toList();

        Map<UUID, Integer> columns = new HashMap<>();
        for (int column = 0; column < productIds.size(); column++) {
            columns.put(productIds.get(column), column);
        }

        double[][] scores = new double[userIds.size()][productIds.size()];

        int cells = 0;
        for (int row = 0; row < userIds.size(); row++) {
            List<InteractionEvent> events = eventsByUser.getOrDefault(userIds.get(row), List.of());
            for (InteractionEvent event : events) {
                Integer column = columns.get(event.getProductId());
                if (column == null) {
                    continue;
                }
                double score = score(event, now);
                if (score > scores[row][column]) {
                    if (scores[row][column] == 0) {
                        cells++;
                    }
                    scores[row][column] = score;
                }
            }
        }

        log.debug("Built interaction matrix: users={}, products={}, nonZeroCells={}",
                userIds.size(), productIds.size(), cells);
        return new InteractionMatrix(userIds, productIds, scores);
    }

    /**
     * Score of a single event at the given instant. Future timestamps count as now.
     */
    public double score(InteractionEvent event, Instant now) {
        RecommendationConfig.Matrix settings = config.getMatrix();

        double days = event.getTimestamp() != null
                ? Math.max(0, Duration.between(event.getTimestamp(), now).toMillis() / MILLIS_PER_DAY)
                : 0;
        double recency = Math.exp(-days / settings.getDecayDays());

        double duration = 0;
        if (event.getDurationSeconds() != null && event.getDurationSeconds() > 0) {
            double cap = settings.getDurationCapMinutes();
            duration = Math.min(event.getDurationSeconds() / 60.0, cap) / cap;
        }

        return recency * settings.getRecencyWeight() + duration * settings.getDurationWeight();
    }
}
