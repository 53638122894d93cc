package ru.tigran.stylistengine.feature;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.tigran.stylistengine.exception.FeatureExtractionUnavailableException;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.util.CacheKeyUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one image out to every registered {@link FeatureSourceClient} concurrently.
 *
 * Each call runs on the {@code featureExtractionExecutor} pool behind its own circuit
 * breaker and deadline. A failing or slow source never blocks the others; the result
 * is the list of bags that did arrive. Only when no source succeeds is
 * {@link FeatureExtractionUnavailableException} thrown. No caching at this layer.
 */
@Slf4j
@Service
public class FeatureExtractionService {

    private final List<FeatureSourceClient> clients;
    private final Executor executor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Timer extractionTimer;
    private final Map<FeatureSource, Counter> failureCounters = new EnumMap<>(FeatureSource.class);

    public FeatureExtractionService(
            List<FeatureSourceClient> clients,
            @Qualifier("featureExtractionExecutor") Executor executor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry
    ) {
        this.clients = List.copyOf(clients);
        this.executor = executor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.extractionTimer = Timer.builder("features.extraction.time")
                .description("Wall time of one concurrent extraction across all sources")
                .register(meterRegistry);
        for (FeatureSource source : FeatureSource.values()) {
            failureCounters.put(source, Counter.builder("features.source.failure")
                    .description("Feature source calls that failed or timed out")
                    .tag("source", source.getValue())
                    .register(meterRegistry));
        }
        log.info("Feature extraction configured with sources: {}",
                this.clients.stream().map(c -> c.source().getValue()).toList());
    }

    public List<FeatureBag> extract(byte[] image) {
        if (image == null || image.length == 0) {
            throw ValidationException.emptyImage();
        }
        return extract(CacheKeyUtils.imageHash(image), image);
    }

    /**
     * @param imageHash hash of {@code image}, used only for error reporting and logs
     */
    public List<FeatureBag> extract(String imageHash, byte[] image) {
        long start = System.nanoTime();
        try {
            return doExtract(imageHash, image);
        } finally {
            extractionTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }

    private List<FeatureBag> doExtract(String imageHash, byte[] image) {
        List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>(clients.size());
        for (FeatureSourceClient client : clients) {
            futures.add(submit(client, image));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<FeatureBag> bags = new ArrayList<>();
        List<SourceFailure> failures = new ArrayList<>();
        for (CompletableFuture<SourceOutcome> future : futures) {
            SourceOutcome outcome = future.join();
            if (outcome.bag() != null) {
                bags.add(outcome.bag());
            } else {
                failures.add(outcome.failure());
                failureCounters.get(outcome.failure().source()).increment();
                log.warn("Feature source {} failed for image {}: {}",
                        outcome.failure().source().getValue(), imageHash, outcome.failure().reason());
            }
        }

        if (bags.isEmpty()) {
            log.error("All {} feature sources failed for image {}", failures.size(), imageHash);
            throw new FeatureExtractionUnavailableException(imageHash, failures);
        }
        log.debug("Extracted {} bags for image {} ({} sources failed)", bags.size(), imageHash, failures.size());
        return bags;
    }

    private CompletableFuture<SourceOutcome> submit(FeatureSourceClient client, byte[] image) {
        FeatureSource source = client.source();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(source.getCircuitBreakerName());
        long timeoutMs = client.timeout().toMillis();

        CompletableFuture<FeatureBag> call;
        try {
            call = CompletableFuture.supplyAsync(
                    CircuitBreaker.decorateSupplier(circuitBreaker, () -> client.extract(image)),
                    executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(SourceOutcome.failed(source, "rejected: executor queue is full"));
        }

        return call
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((bag, error) -> {
                    if (error != null) {
                        return SourceOutcome.failed(source, describe(error, timeoutMs));
                    }
                    if (bag == null) {
                        return SourceOutcome.failed(source, "source returned no result");
                    }
                    return SourceOutcome.succeeded(bag);
                });
    }

    static String describe(Throwable error, long timeoutMs) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeoutMs + "ms";
        }
        if (cause instanceof CallNotPermittedException) {
            return "circuit breaker open";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private record SourceOutcome(FeatureBag bag, SourceFailure failure) {
        static SourceOutcome succeeded(FeatureBag bag) {
            return new SourceOutcome(bag, null);
        }

        static SourceOutcome failed(FeatureSource source, String reason) {
            return new SourceOutcome(null, new SourceFailure(source, reason));
        }
    }
}
