package com.shopsense.events.store;

import com.shopsense.events.dto.InteractionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Each user's history is an immutable list replaced
 * atomically inside {@link ConcurrentHashMap#compute}, so concurrent appends
 * for the same user serialize and readers never observe a half-written list.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shopsense.interactions.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryInteractionStore implements InteractionStore {

    private final ConcurrentHashMap<UUID, List<InteractionEvent>> histories = new ConcurrentHashMap<>();
    private final int historySize;

    public InMemoryInteractionStore(@Value("${shopsense.interactions.history-size:100}") int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("shopsense.interactions.history-size must be positive");
        }
        this.historySize = historySize;
        log.info("In-memory interaction store enabled: historySize={}", historySize);
    }

    @Override
    public void append(InteractionEvent event) {
        histories.compute(event.getUserId(), (userId, current) -> {
            List<InteractionEvent> updated = new ArrayList<>(historySize);
            updated.add(event);
            if (current != null) {
                updated.addAll(current.subList(0, Math.min(current.size(), historySize - 1)));
            }
            return Collections.unmodifiableList(updated);
        });
    }

    @Override
    public List<InteractionEvent> recent(UUID userId) {
        return histories.getOrDefault(userId, List.of());
    }

    @Override
    public Map<UUID, List<InteractionEvent>> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(histories));
    }
}
