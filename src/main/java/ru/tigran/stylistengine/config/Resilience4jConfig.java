package ru.tigran.stylistengine.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.time.Duration;

/**
 * Конфигурация Resilience4j: по одному circuit breaker на каждый источник признаков
 * и отдельный для AI провайдера
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String AI_PROVIDER = "aiProvider";

    /**
     * Открывается при 50% ошибок в окне из 10 вызовов (минимум 5),
     * остается открытым 20 секунд, затем HALF_OPEN
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(Duration.ofSeconds(10))
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(Duration.ofSeconds(20))
                .recordExceptions(Exception.class)
                .ignoreExceptions(IllegalArgumentException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> {
                    CircuitBreaker added = event.getAddedEntry();
                    log.info("CircuitBreaker created: {}", added.getName());
                    registerEventLogging(added);
                })
                .onEntryRemoved(event -> log.info("CircuitBreaker removed: {}", event.getRemovedEntry().getName()))
                .onEntryReplaced(event -> log.info("CircuitBreaker replaced: {}", event.getNewEntry().getName()));

        // создаем заранее, чтобы состояние было видно в actuator с первого запроса
        for (FeatureSource source : FeatureSource.values()) {
            registry.circuitBreaker(source.getCircuitBreakerName());
        }

        return registry;
    }

    @Bean
    public CircuitBreaker aiProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(AI_PROVIDER);
    }

    private static void registerEventLogging(CircuitBreaker circuitBreaker) {
        String name = circuitBreaker.getName();
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker {} state changed: {} -> {}",
                    name,
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.debug("CircuitBreaker {} recorded error: {}", name, event.getThrowable().getMessage()))
                .onSuccess(event -> log.debug("CircuitBreaker {} recorded success", name));
    }
}
