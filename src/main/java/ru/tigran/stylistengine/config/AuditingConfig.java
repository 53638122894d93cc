package ru.tigran.stylistengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.Optional;

/**
 * Конфигурация для поддержки аудита сущностей
 * Автоматически заполняет createdBy, updatedBy, createdAt, updatedAt, version
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {

    static final String SYSTEM_AUDITOR = "system";

    /**
     * Аудитор: "user-{userId}" из пути текущего запроса, вне HTTP запроса 'system'.
     */
    @Bean
    public AuditorAware<String> auditorAware() {
        return () -> Optional.of(currentAuditor());
    }

    static String currentAuditor() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return SYSTEM_AUDITOR;
        }
        Object variables = attributes.getAttribute(
                HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (variables instanceof Map<?, ?> map && map.get("userId") != null) {
            return "user-" + map.get("userId");
        }
        return SYSTEM_AUDITOR;
    }
}
