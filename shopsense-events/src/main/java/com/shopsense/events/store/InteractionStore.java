package com.shopsense.events.store;

import com.shopsense.events.dto.InteractionEvent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-user interaction history, newest first and capped at a configured size.
 * Appends for one user are atomic with respect to each other; readers always
 * see a complete list.
 */
public interface InteractionStore {

    void append(InteractionEvent event);

    /**
     * @return the user's events, newest first; empty when the user has none
     */
    List<InteractionEvent> recent(UUID userId);

    /**
     * Point-in-time copy of every user's history, used to build a model generation.
     */
    Map<UUID, List<InteractionEvent>> snapshot();

    default Set<UUID> recentlyViewed(UUID userId) {
        Set<UUID> viewed = new LinkedHashSet<>();
        for (InteractionEvent event : recent(userId)) {
            if (event.isView()) {
                viewed.add(event.getProductId());
            }
        }
        return viewed;
    }
}
