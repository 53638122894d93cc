package ru.tigran.stylistengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Конфигурация health checks для внешних зависимостей.
 * Redis и PostgreSQL проверяет сам Spring Boot Actuator.
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Health check для AI провайдера (OpenRouter).
     * Пингует эндпоинт ключа: он дешевый и не тратит токены.
     */
    @Bean
    public HealthIndicator aiProviderHealthIndicator(
            RestClient restClient,
            @Value("${app.openrouter.health-url:https://openrouter.ai/api/v1/auth/key}") String healthUrl,
            @Value("${app.openrouter.api-key:}") String apiKey
    ) {
        return () -> {
            try {
                restClient.get()
                        .uri(healthUrl)
                        .header("Authorization", "Bearer " + apiKey)
                        .retrieve()
                        .toBodilessEntity();

                log.debug("AI Provider health check: OK");
                return Health.up()
                        .withDetail("status", "AI Provider is available")
                        .build();
            } catch (Exception e) {
                log.warn("AI Provider health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }

    /**
     * Fashion-CLIP сервис опционален: без URL источник просто выпадает из fusion.
     */
    @Bean
    public HealthIndicator fashionModelHealthIndicator(
            RestClient restClient,
            @Value("${app.features.fashion-model.health-url:}") String healthUrl
    ) {
        return () -> {
            if (healthUrl == null || healthUrl.isBlank()) {
                return Health.unknown()
                        .withDetail("status", "Fashion model health URL not configured")
                        .build();
            }
            try {
                restClient.get()
                        .uri(healthUrl)
                        .retrieve()
                        .toBodilessEntity();
                return Health.up().build();
            } catch (Exception e) {
                log.warn("Fashion model health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }
}
