package ru.tigran.stylistengine.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.IOException;
import java.util.UUID;

/**
 * Конфигурация для web (CORS, логирование запросов)
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final long SLOW_REQUEST_MS = 1000;

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:8080}")
    private String allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(REQUEST_ID_HEADER)
                .maxAge(3600);

        registry.addMapping("/actuator/**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET")
                .maxAge(3600);
    }

    /**
     * Логирование запросов. Request id берется из заголовка или генерируется,
     * кладется в MDC и возвращается клиенту.
     * Анализ фото с тремя источниками легко упирается в порог медленного запроса, поэтому
     * медленные запросы пишутся в INFO, ошибки в WARN, остальное в DEBUG.
     */
    @Bean
    public OncePerRequestFilter requestLoggingFilter() {
        return new OncePerRequestFilter() {
            @Override
            protected void doFilterInternal(
                    HttpServletRequest request,
                    HttpServletResponse response,
                    FilterChain filterChain
            ) throws ServletException, IOException {
                long startTime = System.currentTimeMillis();
                String requestId = request.getHeader(REQUEST_ID_HEADER);
                if (requestId == null || requestId.isBlank()) {
                    requestId = UUID.randomUUID().toString();
                }
                MDC.put(REQUEST_ID_MDC_KEY, requestId);
                response.setHeader(REQUEST_ID_HEADER, requestId);

                try {
                    filterChain.doFilter(request, response);
                } finally {
                    long duration = System.currentTimeMillis() - startTime;
                    int status = response.getStatus();
                    String method = request.getMethod();
                    String uri = request.getRequestURI();

                    if (status >= 400) {
                        log.warn("Request: {} {} - Status: {} - Duration: {}ms", method, uri, status, duration);
                    } else if (duration > SLOW_REQUEST_MS) {
                        log.info("Request: {} {} - Status: {} - Duration: {}ms (slow)", method, uri, status, duration);
                    } else {
                        log.debug("Request: {} {} - Status: {} - Duration: {}ms", method, uri, status, duration);
                    }
                    MDC.remove(REQUEST_ID_MDC_KEY);
                }
            }
        };
    }
}
