package ru.tigran.stylistengine.feature;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.FeatureExtractionUnavailableException;
import ru.tigran.stylistengine.exception.ValidationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeatureExtractionService unit тесты")
class FeatureExtractionServiceTest {

    private static final byte[] IMAGE = {1, 2, 3, 4};

    private ExecutorService executor;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private FeatureExtractionService service(FeatureSourceClient... clients) {
        return new FeatureExtractionService(List.of(clients), executor, circuitBreakerRegistry, meterRegistry);
    }

    private static FeatureSourceClient client(FeatureSource source, Duration timeout,
                                              Function<byte[], FeatureBag> body) {
        return new FeatureSourceClient() {
            @Override
            public FeatureSource source() {
                return source;
            }

            @Override
            public Duration timeout() {
                return timeout;
            }

            @Override
            public FeatureBag extract(byte[] image) {
                return body.apply(image);
            }
        };
    }

    private static FeatureSourceClient succeeding(FeatureSource source, String feature) {
        return client(source, Duration.ofSeconds(2), image -> new FeatureBag(source, Map.of(feature, 0.9)));
    }

    private static FeatureSourceClient failing(FeatureSource source, String message) {
        return client(source, Duration.ofSeconds(2), image -> {
            throw new FeatureSourceException(message);
        });
    }

    private static FeatureSourceClient sleeping(FeatureSource source, Duration timeout, long sleepMs) {
        return client(source, timeout, image -> {
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new FeatureBag(source, Map.of("style:late", 0.9));
        });
    }

    @Test
    @DisplayName("extract - все источники отвечают, по одному bag на источник")
    void allSourcesSucceed() {
        FeatureExtractionService service = service(
                succeeding(FeatureSource.FASHION_MODEL, "style:casual"),
                succeeding(FeatureSource.VISION_MODEL, "category:shirt"),
                succeeding(FeatureSource.COLOR_HEURISTIC, "color:navy"));

        List<FeatureBag> bags = service.extract(IMAGE);

        assertEquals(3, bags.size());
        assertEquals(List.of(FeatureSource.FASHION_MODEL, FeatureSource.VISION_MODEL, FeatureSource.COLOR_HEURISTIC),
                bags.stream().map(FeatureBag::source).toList());
        assertEquals(1, meterRegistry.timer("features.extraction.time").count());
    }

    @Test
    @DisplayName("extract - отказ одного источника не мешает остальным")
    void partialFailure() {
        FeatureExtractionService service = service(
                failing(FeatureSource.FASHION_MODEL, "connection refused"),
                succeeding(FeatureSource.VISION_MODEL, "category:shirt"),
                succeeding(FeatureSource.COLOR_HEURISTIC, "color:navy"));

        List<FeatureBag> bags = service.extract(IMAGE);

        assertEquals(2, bags.size());
        assertTrue(bags.stream().noneMatch(bag -> bag.source() == FeatureSource.FASHION_MODEL));
        assertEquals(1.0, meterRegistry.counter("features.source.failure", "source", "fashion-model").count());
    }

    @Test
    @DisplayName("extract - таймаут медленного источника, быстрые результаты используются")
    void slowSourceTimesOut() {
        FeatureExtractionService service = service(
                sleeping(FeatureSource.FASHION_MODEL, Duration.ofMillis(100), 3000),
                succeeding(FeatureSource.COLOR_HEURISTIC, "color:navy"));

        long start = System.currentTimeMillis();
        List<FeatureBag> bags = service.extract(IMAGE);
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(1, bags.size());
        assertEquals(FeatureSource.COLOR_HEURISTIC, bags.get(0).source());
        assertTrue(elapsed < 2500, "extraction waited for the slow source: " + elapsed + "ms");
    }

    @Test
    @DisplayName("extract - все источники упали, исключение с причиной по каждому")
    void allSourcesFail() {
        FeatureExtractionService service = service(
                failing(FeatureSource.FASHION_MODEL, "http 500"),
                sleeping(FeatureSource.VISION_MODEL, Duration.ofMillis(50), 2000),
                failing(FeatureSource.COLOR_HEURISTIC, "unsupported image format"));

        FeatureExtractionUnavailableException exception = assertThrows(
                FeatureExtractionUnavailableException.class, () -> service.extract(IMAGE));

        assertEquals(ErrorCode.FEATURE_EXTRACTION_UNAVAILABLE.getCode(), exception.getErrorCode());
        assertTrue(exception.isRetriable());
        assertEquals(64, exception.getImageHash().length());
        assertEquals(3, exception.getFailures().size());
        assertTrue(exception.getFailures().stream()
                .anyMatch(f -> f.source() == FeatureSource.VISION_MODEL && f.reason().equals("timed out after 50ms")));
        assertTrue(exception.getFailures().stream()
                .anyMatch(f -> f.source() == FeatureSource.FASHION_MODEL && f.reason().equals("http 500")));
    }

    @Test
    @DisplayName("extract - открытый circuit breaker считается отказом источника")
    void openCircuitBreaker() {
        circuitBreakerRegistry.circuitBreaker(FeatureSource.FASHION_MODEL.getCircuitBreakerName()).transitionToForcedOpenState();
        FeatureExtractionService service = service(
                succeeding(FeatureSource.FASHION_MODEL, "style:casual"));

        FeatureExtractionUnavailableException exception = assertThrows(
                FeatureExtractionUnavailableException.class, () -> service.extract(IMAGE));

        assertEquals("circuit breaker open", exception.getFailures().get(0).reason());
    }

    @Test
    @DisplayName("extract - пустое изображение отклоняется до вызова источников")
    void emptyImageRejected() {
        FeatureExtractionService service = service(succeeding(FeatureSource.FASHION_MODEL, "style:casual"));

        ValidationException exception = assertThrows(ValidationException.class, () -> service.extract(new byte[0]));

        assertEquals(ErrorCode.EMPTY_IMAGE.getCode(), exception.getErrorCode());
    }
}
