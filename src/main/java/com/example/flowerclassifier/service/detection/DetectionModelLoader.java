package com.example.flowerclassifier.service.detection;

import com.example.flowerclassifier.exception.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazily acquires the detection backend and shares it for the lifetime of
 * the application.
 * <p>
 * Concurrent first callers join the same in-flight attempt and observe the
 * same outcome. A failed or timed-out attempt is forgotten, so the next call
 * starts a fresh attempt over all strategies.
 */
public class DetectionModelLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DetectionModelLoader.class);

    private final List<ModelAcquisitionStrategy> strategies;
    private final Duration initTimeout;
    private final ExecutorService initExecutor;
    private final Object lock = new Object();

    // guarded by lock
    private CompletableFuture<LoadedBackend> current;

    public DetectionModelLoader(List<ModelAcquisitionStrategy> strategies, Duration initTimeout) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one model acquisition strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.initTimeout = initTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.initExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "model-init-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @return the shared backend, acquiring it first if necessary
     * @throws ModelUnavailableException when every strategy failed or the
     *                                   attempt did not finish in time
     */
    public DetectionBackend acquire() {
        CompletableFuture<LoadedBackend> attempt;
        synchronized (lock) {
            if (current == null || current.isCompletedExceptionally()) {
                current = startAttempt();
            }
            attempt = current;
        }
        try {
            return attempt.get().backend();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Interrupted while waiting for the detection model", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ModelUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof TimeoutException) {
                throw new ModelUnavailableException(
                        "Detection model initialization did not finish within " + initTimeout.toSeconds() + "s", cause);
            }
            throw new ModelUnavailableException("Detection model initialization failed: " + cause.getMessage(), cause);
        }
    }

    public ModelStatus status() {
        synchronized (lock) {
            if (current == null) {
                return ModelStatus.NOT_LOADED;
            }
            if (!current.isDone()) {
                return ModelStatus.LOADING;
            }
            return current.isCompletedExceptionally() ? ModelStatus.UNAVAILABLE : ModelStatus.READY;
        }
    }

    /**
     * @return name of the strategy that produced the backend, or {@code null}
     * when no backend is loaded
     */
    public String source() {
        synchronized (lock) {
            if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
                return null;
            }
            return current.join().source();
        }
    }

    private CompletableFuture<LoadedBackend> startAttempt() {
        CompletableFuture<LoadedBackend> attempt = new CompletableFuture<>();
        initExecutor.execute(() -> {
            try {
                LoadedBackend loaded = runStrategies();
                if (!attempt.complete(loaded)) {
                    log.warn("Detection model became available via {} after the attempt was abandoned; discarding it",
                            loaded.source());
                    loaded.backend().close();
                }
            } catch (RuntimeException ex) {
                attempt.completeExceptionally(ex);
            }
        });
        return attempt.orTimeout(initTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private LoadedBackend runStrategies() {
        List<String> failures = new ArrayList<>(strategies.size());
        for (ModelAcquisitionStrategy strategy : strategies) {
            AcquisitionResult result = tryStrategy(strategy);
            if (result.succeeded()) {
                log.info("Detection model acquired via '{}' strategy", strategy.name());
                return new LoadedBackend(strategy.name(), result.backend());
            }
            log.warn("Model acquisition strategy '{}' failed: {}", strategy.name(), result.failureReason());
            failures.add(strategy.name() + ": " + result.failureReason());
        }
        throw new ModelUnavailableException("All model acquisition strategies failed", failures);
    }

    private AcquisitionResult tryStrategy(ModelAcquisitionStrategy strategy) {
        try {
            return strategy.acquire();
        } catch (RuntimeException ex) {
            log.error("Model acquisition strategy '{}' threw unexpectedly", strategy.name(), ex);
            return AcquisitionResult.failure("unexpected error: " + ex.getMessage());
        }
    }

    @Override
    public void close() {
        initExecutor.shutdownNow();
        synchronized (lock) {
            if (current != null && current.isDone() && !current.isCompletedExceptionally()) {
                current.join().backend().close();
                log.info("Detection model released");
            }
            current = null;
        }
    }

    private record LoadedBackend(String source, DetectionBackend backend) {
    }
}
