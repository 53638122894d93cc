package ru.tigran.stylistengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger UI: /swagger-ui.html, спецификация: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI stylistEngineOpenAPI(
            @Value("${app.api.version:0.1.0}") String version,
            @Value("${app.api.server-url:http://localhost:8080}") String serverUrl
    ) {
        return new OpenAPI()
                .info(new Info()
                        .title("Stylist Engine API")
                        .version(version)
                        .description("""
                                Гардероб с извлечением признаков из фото (fashion-модель, vision-модель, \
                                цвет/бренд эвристика), визуальный квиз стиля и подбор образов из вещей пользователя.

                                Ошибки возвращаются как {"code": "...", "message": "..."}; \
                                для временных сбоев (503, 502 при открытом circuit breaker) выставляется Retry-After."""))
                .servers(List.of(new Server().url(serverUrl)));
    }
}
