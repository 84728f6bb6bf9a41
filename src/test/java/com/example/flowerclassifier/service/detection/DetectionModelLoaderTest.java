package com.example.flowerclassifier.service.detection;

import com.example.flowerclassifier.exception.ModelUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class DetectionModelLoaderTest {

    private final List<DetectionModelLoader> loaders = new ArrayList<>();

    @AfterEach
    void closeLoaders() {
        loaders.forEach(DetectionModelLoader::close);
    }

    @Test
    void firstSuccessfulStrategyWinsAndLaterOnesAreSkipped() {
        DetectionBackend cached = mock(DetectionBackend.class);
        StubStrategy remote = new StubStrategy("remote", () -> AcquisitionResult.failure("offline"));
        StubStrategy cache = new StubStrategy("cache", () -> AcquisitionResult.success(cached));
        StubStrategy local = new StubStrategy("local", () -> AcquisitionResult.success(mock(DetectionBackend.class)));
        DetectionModelLoader loader = loader(Duration.ofSeconds(5), remote, cache, local);

        assertThat(loader.status()).isEqualTo(ModelStatus.NOT_LOADED);
        assertThat(loader.acquire()).isSameAs(cached);
        assertThat(remote.calls()).isEqualTo(1);
        assertThat(local.calls()).isZero();
        assertThat(loader.status()).isEqualTo(ModelStatus.READY);
        assertThat(loader.source()).isEqualTo("cache");
    }

    @Test
    void loadedBackendIsReusedWithoutRunningStrategiesAgain() {
        DetectionBackend backend = mock(DetectionBackend.class);
        StubStrategy local = new StubStrategy("local", () -> AcquisitionResult.success(backend));
        DetectionModelLoader loader = loader(Duration.ofSeconds(5), local);

        loader.acquire();
        loader.acquire();

        assertThat(local.calls()).isEqualTo(1);
    }

    @Test
    void failureAggregatesTheReasonOfEveryStrategy() {
        DetectionModelLoader loader = loader(Duration.ofSeconds(5),
                new StubStrategy("remote", () -> AcquisitionResult.failure("download failed")),
                new StubStrategy("local", () -> AcquisitionResult.failure("model file not found")));

        assertThatThrownBy(loader::acquire)
                .hasMessageContaining("All model acquisition strategies failed")
                .isInstanceOfSatisfying(ModelUnavailableException.class, ex -> assertThat(ex.getReasons())
                        .containsExactly("remote: download failed", "local: model file not found"));
        assertThat(loader.status()).isEqualTo(ModelStatus.UNAVAILABLE);
        assertThat(loader.source()).isNull();
    }

    @Test
    void strategyThrowingIsTreatedAsFailedStrategy() {
        DetectionBackend backend = mock(DetectionBackend.class);
        DetectionModelLoader loader = loader(Duration.ofSeconds(5),
                new StubStrategy("remote", () -> {
                    throw new IllegalArgumentException("bad url");
                }),
                new StubStrategy("local", () -> AcquisitionResult.success(backend)));

        assertThat(loader.acquire()).isSameAs(backend);
        assertThat(loader.source()).isEqualTo("local");
    }

    @Test
    void failedAttemptIsRetriedOnNextCall() {
        AtomicBoolean available = new AtomicBoolean(false);
        DetectionBackend backend = mock(DetectionBackend.class);
        StubStrategy local = new StubStrategy("local", () -> available.get()
                ? AcquisitionResult.success(backend)
                : AcquisitionResult.failure("model file not found"));
        DetectionModelLoader loader = loader(Duration.ofSeconds(5), local);

        assertThatThrownBy(loader::acquire).isInstanceOf(ModelUnavailableException.class);

        available.set(true);
        assertThat(loader.acquire()).isSameAs(backend);
        assertThat(local.calls()).isEqualTo(2);
    }

    @Test
    void concurrentFirstCallersShareOneAcquisition() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DetectionBackend backend = mock(DetectionBackend.class);
        StubStrategy slow = new StubStrategy("remote", () -> {
            entered.countDown();
            awaitQuietly(release);
            return AcquisitionResult.success(backend);
        });
        DetectionModelLoader loader = loader(Duration.ofSeconds(10), slow);

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<DetectionBackend>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(loader::acquire));
            }
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(loader.status()).isEqualTo(ModelStatus.LOADING);
            release.countDown();

            for (Future<DetectionBackend> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(backend);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(slow.calls()).isEqualTo(1);
    }

    @Test
    void slowAcquisitionTimesOutAndLateBackendIsReleased() {
        CountDownLatch release = new CountDownLatch(1);
        DetectionBackend late = mock(DetectionBackend.class);
        DetectionModelLoader loader = loader(Duration.ofMillis(100), new StubStrategy("remote", () -> {
            awaitQuietly(release);
            return AcquisitionResult.success(late);
        }));

        try {
            assertThatThrownBy(loader::acquire)
                    .isInstanceOf(ModelUnavailableException.class)
                    .hasMessageContaining("did not finish");
            assertThat(loader.status()).isEqualTo(ModelStatus.UNAVAILABLE);
        } finally {
            release.countDown();
        }
        verify(late, timeout(2000)).close();
    }

    @Test
    void closeReleasesLoadedBackend() {
        DetectionBackend backend = mock(DetectionBackend.class);
        DetectionModelLoader loader = new DetectionModelLoader(
                List.of(new StubStrategy("local", () -> AcquisitionResult.success(backend))), Duration.ofSeconds(5));
        loader.acquire();

        loader.close();

        verify(backend).close();
        assertThat(loader.status()).isEqualTo(ModelStatus.NOT_LOADED);
    }

    @Test
    void requiresAtLeastOneStrategy() {
        assertThatThrownBy(() -> new DetectionModelLoader(List.of(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private DetectionModelLoader loader(Duration timeout, ModelAcquisitionStrategy... strategies) {
        DetectionModelLoader loader = new DetectionModelLoader(List.of(strategies), timeout);
        loaders.add(loader);
        return loader;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class StubStrategy implements ModelAcquisitionStrategy {

        private final String name;
        private final Supplier<AcquisitionResult> outcome;
        private final AtomicInteger calls = new AtomicInteger();

        private StubStrategy(String name, Supplier<AcquisitionResult> outcome) {
            this.name = name;
            this.outcome = outcome;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public AcquisitionResult acquire() {
            calls.incrementAndGet();
            return outcome.get();
        }

        int calls() {
            return calls.get();
        }
    }
}
