package com.shopsense.events.store;

import com.shopsense.common.enums.InteractionType;
import com.shopsense.events.dto.InteractionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryInteractionStoreTest {

    private static final UUID USER = UUID.randomUUID();

    @Test
    void keepsNewestFirstAndCapsHistory() {
        InMemoryInteractionStore store = new InMemoryInteractionStore(3);
        List<UUID> products = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        products.forEach(productId -> store.append(event(USER, productId, InteractionType.VIEW)));

        assertThat(store.recent(USER))
                .extracting(InteractionEvent::getProductId)
                .containsExactly(products.get(3), products.get(2), products.get(1));
    }

    @Test
    void unknownUserHasEmptyHistory() {
        assertThat(new InMemoryInteractionStore(10).recent(UUID.randomUUID())).isEmpty();
    }

    @Test
    void recentlyViewedIgnoresOtherInteractionTypes() {
        InMemoryInteractionStore store = new InMemoryInteractionStore(10);
        UUID viewed = UUID.randomUUID();
        UUID purchased = UUID.randomUUID();

        store.append(event(USER, viewed, InteractionType.VIEW));
        store.append(event(USER, purchased, InteractionType.PURCHASE));

        assertThat(store.recentlyViewed(USER)).containsExactly(viewed);
    }

    @Test
    void snapshotIsNotAffectedByLaterAppends() {
        InMemoryInteractionStore store = new InMemoryInteractionStore(10);
        store.append(event(USER, UUID.randomUUID(), InteractionType.VIEW));

        Map<UUID, List<InteractionEvent>> snapshot = store.snapshot();
        store.append(event(USER, UUID.randomUUID(), InteractionType.VIEW));
        store.append(event(UUID.randomUUID(), UUID.randomUUID(), InteractionType.VIEW));

        assertThat(snapshot).hasSize(1);
        assertThat(snapshot.get(USER)).hasSize(1);
    }

    @Test
    void concurrentAppendsForOneUserAreNotLost() throws InterruptedException {
        InMemoryInteractionStore store = new InMemoryInteractionStore(1000);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(400);

        for (int i = 0; i < 400; i++) {
            executor.submit(() -> {
                store.append(event(USER, UUID.randomUUID(), InteractionType.VIEW));
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(store.recent(USER)).hasSize(400);
    }

    @Test
    void rejectsNonPositiveHistorySize() {
        assertThatThrownBy(() -> new InMemoryInteractionStore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static InteractionEvent event(UUID userId, UUID productId, InteractionType type) {
        return InteractionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .userId(userId)
                .productId(productId)
                .type(type)
                .timestamp(Instant.now())
                .build();
    }
}
