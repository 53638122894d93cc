package ru.tigran.stylistengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import ru.tigran.stylistengine.fusion.ConsensusCache;
import ru.tigran.stylistengine.fusion.InMemoryConsensusCache;
import ru.tigran.stylistengine.fusion.RedisConsensusCache;

/**
 * Выбор хранилища consensus-кеша по app.fusion.cache.type.
 * - redis (по умолчанию): общий кеш для всех инстансов
 * - memory: локальная карта, для dev и тестов без Redis
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "app.fusion.cache.type", havingValue = "redis", matchIfMissing = true)
    public ConsensusCache redisConsensusCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        log.info("Consensus cache: Redis");
        return new RedisConsensusCache(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "app.fusion.cache.type", havingValue = "memory")
    public ConsensusCache inMemoryConsensusCache() {
        log.info("Consensus cache: in-memory");
        return new InMemoryConsensusCache();
    }
}
