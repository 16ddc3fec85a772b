package com.shopsense.engine.service;

import com.shopsense.catalog.service.ProductService;
import com.shopsense.catalog.service.UserProfileService;
import com.shopsense.common.enums.InteractionType;
import com.shopsense.engine.config.RecommendationConfig;
import com.shopsense.engine.model.ModelGeneration;
import com.shopsense.engine.model.ModelHandle;
import com.shopsense.engine.service.ModelRefreshService.RefreshResult;
import com.shopsense.engine.service.ModelRefreshService.RefreshStatus;
import com.shopsense.events.store.InteractionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.shopsense.engine.EngineFixtures.event;
import static com.shopsense.engine.EngineFixtures.id;
import static com.shopsense.engine.EngineFixtures.product;
import static com.shopsense.engine.EngineFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelRefreshServiceTest {

    private static final UUID USER = id(1);
    private static final UUID PRODUCT = id(101);

    @Mock
    private UserProfileService userProfileService;
    @Mock
    private ProductService productService;
    @Mock
    private InteractionStore interactionStore;

    private final RecommendationConfig config = new RecommendationConfig();
    private final ModelHandle modelHandle = new ModelHandle();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));

    private ModelRefreshService service;

    @BeforeEach
    void setUp() {
        config.getRefresh().setEventThreshold(3);
        service = new ModelRefreshService(
                userProfileService,
                productService,
                interactionStore,
                new FeatureEncoder(config),
                new InteractionMatrixBuilder(config),
                modelHandle,
                config,
                clock);
    }

    private void stubCatalog() {
        when(userProfileService.getActiveProfiles()).thenReturn(List.of(user(USER)));
        when(productService.getActiveProducts()).thenReturn(List.of(product(PRODUCT)));
        when(interactionStore.snapshot()).thenReturn(Map.of(USER, List.of(
                event(USER, PRODUCT, InteractionType.VIEW, clock.instant(), 60))));
    }

    @Test
    void publishesIncreasingGenerations() {
        stubCatalog();

        RefreshResult first = service.refresh();
        RefreshResult second = service.refresh();

        assertThat(first.status()).isEqualTo(RefreshStatus.REFRESHED);
        assertThat(first.generation()).isEqualTo(1L);
        assertThat(first.users()).isEqualTo(1);
        assertThat(first.products()).isEqualTo(1);
        assertThat(first.events()).isEqualTo(1);
        assertThat(second.generation()).isEqualTo(2L);

        ModelGeneration current = modelHandle.current();
        assertThat(current.generation()).isEqualTo(2L);
        assertThat(current.builtAt()).isEqualTo(clock.instant());
        assertThat(current.matrix().score(0, 0)).isGreaterThan(0);
        assertThat(current.embeddings().userVector(USER)).isPresent();
        assertThat(current.embeddings().getDimensions()).isEqualTo(13 + 8);
    }

    @Test
    void failedRefreshKeepsPreviousGenerationUntilRetrySucceeds() {
        stubCatalog();
        service.refresh();

        when(productService.getActiveProducts()).thenThrow(new IllegalStateException("catalog offline"));
        RefreshResult failed = service.refresh();

        assertThat(failed.status()).isEqualTo(RefreshStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo("catalog offline");
        assertThat(service.isLastAttemptFailed()).isTrue();
        assertThat(service.getLastError()).isEqualTo("catalog offline");
        assertThat(modelHandle.current().generation()).isEqualTo(1L);

        for (int i = 0; i < 5; i++) {
            assertThat(service.recordEvent()).isFalse();
        }

        doReturn(List.of(product(PRODUCT))).when(productService).getActiveProducts();
        service.scheduledCheck();

        assertThat(service.isLastAttemptFailed()).isFalse();
        assertThat(service.getLastError()).isNull();
        assertThat(modelHandle.current().generation()).isEqualTo(2L);
    }

    @Test
    void concurrentRefreshIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(userProfileService.getActiveProfiles()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of(user(USER));
        });
        when(productService.getActiveProducts()).thenReturn(List.of(product(PRODUCT)));
        when(interactionStore.snapshot()).thenReturn(Map.of());

        CompletableFuture<RefreshResult> running = CompletableFuture.supplyAsync(service::refresh);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isRefreshInProgress()).isTrue();
        assertThat(service.refresh().status()).isEqualTo(RefreshStatus.SKIPPED);
        assertThat(service.recordEvent()).isFalse();

        release.countDown();
        assertThat(running.get(5, TimeUnit.SECONDS).status()).isEqualTo(RefreshStatus.REFRESHED);
        assertThat(service.isRefreshInProgress()).isFalse();
    }

    @Test
    void dueOnFirstUseThenByEventCountOrInterval() {
        assertThat(service.isRefreshDue()).isTrue();

        stubCatalog();
        service.refresh();
        assertThat(service.isRefreshDue()).isFalse();

        assertThat(service.recordEvent()).isFalse();
        assertThat(service.recordEvent()).isFalse();
        assertThat(service.recordEvent()).isTrue();
        assertThat(service.getEventsSinceRefresh()).isEqualTo(3);

        service.refresh();
        assertThat(service.getEventsSinceRefresh()).isZero();
        assertThat(service.isRefreshDue()).isFalse();

        clock.advance(Duration.ofMinutes(15));
        assertThat(service.isRefreshDue()).isTrue();
    }

    @Test
    void startupRefreshCanBeDisabled() {
        config.getRefresh().setOnStartup(false);

        service.onApplicationReady();

        assertThat(modelHandle.find()).isEmpty();
        assertThat(service.getLastAttemptAt()).isNull();
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
