package com.shopsense.engine.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.catalog.service.ProductService;
import com.shopsense.catalog.service.UserProfileService;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.EmbeddingIndex;
import com.shopsense.engine.model.InteractionMatrix;
import com.shopsense.engine.model.ModelGeneration;
import com.shopsense.engine.model.ModelHandle;
import com.shopsense.events.dto.InteractionEvent;
import com.shopsense.events.store.InteractionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds model generations and decides when to rebuild.
 *
 * A refresh reads one consistent snapshot (active users, active products,
 * interaction histories, one timestamp), builds the matrix and embeddings off
 * to the side and publishes them through {@link ModelHandle}. Only one refresh
 * runs at a time; a request that arrives meanwhile is skipped. A failed refresh
 * keeps the previous generation and is retried by the scheduled check.
 */
@Slf4j
@Service
public class ModelRefreshService {

    private final UserProfileService userProfileService;
    private final ProductService productService;
    private final InteractionStore interactionStore;
    private final FeatureEncoder featureEncoder;
    private final InteractionMatrixBuilder matrixBuilder;
    private final ModelHandle modelHandle;
    private final RecommendationConfig config;
    private final Clock clock;

    private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);
    private final AtomicLong eventsSinceRefresh = new AtomicLong();
    private final AtomicLong generationCounter = new AtomicLong();

    private volatile Instant lastAttemptAt;
    private volatile boolean lastAttemptFailed;
    private volatile String lastError;

    public ModelRefreshService(UserProfileService userProfileService,
                               ProductService productService,
                               InteractionStore interactionStore,
                               FeatureEncoder featureEncoder,
                               InteractionMatrixBuilder matrixBuilder,
                               ModelHandle modelHandle,
                               RecommendationConfig config,
                               Clock clock) {
        this.userProfileService = userProfileService;
        this.productService = productService;
        this.interactionStore = interactionStore;
        this.featureEncoder = featureEncoder;
        this.matrixBuilder = matrixBuilder;
        this.modelHandle = modelHandle;
        this.config = config;
        this.clock = clock;
    }

    public enum RefreshStatus {
        REFRESHED,
        SKIPPED,
        FAILED
    }

    /**
     * Result of a refresh request.
     */
    public record RefreshResult(
            RefreshStatus status,
            Long generation,
            int users,
            int products,
            long events,
            long durationMs,
            String errorMessage
    ) {
        public static RefreshResult skipped() {
            return new RefreshResult(RefreshStatus.SKIPPED, null, 0, 0, 0, 0, null);
        }

        public static RefreshResult failure(String errorMessage, long durationMs) {
            return new RefreshResult(RefreshStatus.FAILED, null, 0, 0, 0, durationMs, errorMessage);
        }
    }

    /**
     * Build the first generation once the application is ready, if configured.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.getRefresh().isOnStartup()) {
            log.info("Building initial model generation on application startup");
            refresh();
        }
    }

    /**
     * Periodic policy check. Also the retry path after a failed refresh.
     */
    @Scheduled(fixedDelayString = "${shopsense.recommendation.refresh.check-interval-ms:60000}",
            initialDelayString = "${shopsense.recommendation.refresh.check-interval-ms:60000}")
    public void scheduledCheck() {
        if (refreshInProgress.get()) {
            return;
        }
        if (lastAttemptFailed || isRefreshDue()) {
            refresh();
        }
    }

    /**
     * Counts a tracked event and reports whether the caller should start a refresh.
     * After a failure this stays false until the scheduled check succeeds.
     */
    public boolean recordEvent() {
        eventsSinceRefresh.incrementAndGet();
        return !lastAttemptFailed && !refreshInProgress.get() && isRefreshDue();
    }

    /**
     * Due when enough events arrived since the last successful refresh, or the
     * interval since the last attempt elapsed, or nothing was ever attempted.
     */
    public boolean isRefreshDue() {
        Instant last = lastAttemptAt;
        if (last == null) {
            return true;
        }
        RecommendationConfig.Refresh settings = config.getRefresh();
        return eventsSinceRefresh.get() >= settings.getEventThreshold()
                || !clock.instant().isBefore(last.plus(settings.getInterval()));
    }

    @Async
    public void refreshAsync() {
        refresh();
    }

    public RefreshResult refresh() {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.info("Model refresh already in progress, skipping");
            return RefreshResult.skipped();
        }

        long startTime = System.currentTimeMillis();
        Instant now = clock.instant();
        lastAttemptAt = now;
        long eventsAtStart = eventsSinceRefresh.get();

        try {
            List<UserProfileDTO> users = userProfileService.getActiveProfiles();
            List<ProductDTO> products = productService.getActiveProducts();
            Map<UUID, List<InteractionEvent>> histories = interactionStore.snapshot();

            InteractionMatrix matrix = matrixBuilder.build(users, products, histories, now);
            EmbeddingIndex embeddings = buildEmbeddings(users, products);
            long eventCount = histories.values().stream().mapToLong(List::size).sum();

            ModelGeneration generation = new ModelGeneration(
                    generationCounter.incrementAndGet(), now, matrix, embeddings, eventCount);
            modelHandle.swap(generation);

            eventsSinceRefresh.addAndGet(-eventsAtStart);
            lastAttemptFailed = false;
            lastError = null;

            long duration = System.currentTimeMillis() - startTime;
            log.info("Model refresh completed in {}ms: generation={}, users={}, products={}, events={}",
                    duration, generation.generation(), matrix.userCount(), matrix.productCount(), eventCount);

            return new RefreshResult(RefreshStatus.REFRESHED, generation.generation(),
                    matrix.userCount(), matrix.productCount(), eventCount, duration, null);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            lastAttemptFailed = true;
            lastError = e.getMessage();
            log.error("Model refresh failed after {}ms: {}", duration, e.getMessage(), e);
            return RefreshResult.failure(e.getMessage(), duration);
        } finally {
            refreshInProgress.set(false);
        }
    }

    private EmbeddingIndex buildEmbeddings(List<UserProfileDTO> users, List<ProductDTO> products) {
        Map<UUID, double[]> userVectors = new LinkedHashMap<>();
        for (UserProfileDTO user : users) {
            if (user.isActive()) {
                userVectors.put(user.getId(), featureEncoder.encodeUser(user));
            }
        }
        Map<UUID, double[]> productVectors = new LinkedHashMap<>();
        for (ProductDTO product : products) {
            if (product.isActive()) {
                productVectors.put(product.getId(), featureEncoder.encodeProduct(product));
            }
        }
        return new EmbeddingIndex(featureEncoder.dimensions(), userVectors, productVectors);
    }

    public boolean isRefreshInProgress() {
        return refreshInProgress.get();
    }

    public long getEventsSinceRefresh() {
        return eventsSinceRefresh.get();
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public boolean isLastAttemptFailed() {
        return lastAttemptFailed;
    }

    public String getLastError() {
        return lastError;
    }
}
