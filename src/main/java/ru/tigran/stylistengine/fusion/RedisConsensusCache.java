package ru.tigran.stylistengine.fusion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import ru.tigran.stylistengine.util.CacheKeyUtils;

import java.util.Optional;

/**
 * Redis-backed cache. Values are JSON, keys are {@code consensus:<hash>}, no TTL.
 *
 * Redis being unreachable degrades to a cache miss on read and a skipped write:
 * the fused result is still returned to the caller.
 */
@Slf4j
public class RedisConsensusCache implements ConsensusCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisConsensusCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ConsensusFeatureSet> get(String imageHash) {
        String key = CacheKeyUtils.consensusKey(imageHash);
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("Redis read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ConsensusFeatureSet.class));
        } catch (JsonProcessingException e) {
            log.warn("Corrupt cache entry {}, evicting: {}", key, e.getMessage());
            invalidate(imageHash);
            return Optional.empty();
        }
    }

    @Override
    public void put(String imageHash, ConsensusFeatureSet featureSet) {
        String key = CacheKeyUtils.consensusKey(imageHash);
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(featureSet));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize consensus feature set", e);
        } catch (DataAccessException e) {
            log.warn("Redis write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void invalidate(String imageHash) {
        String key = CacheKeyUtils.consensusKey(imageHash);
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.warn("Redis delete failed for {}: {}", key, e.getMessage());
        }
    }
}
