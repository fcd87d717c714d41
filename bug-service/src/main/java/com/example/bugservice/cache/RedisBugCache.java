package com.example.bugservice.cache;

import com.example.bugservice.config.BugCacheProperties;
import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Redis-backed {@link BugCache}. Values are JSON strings written with the application ObjectMapper.
 *
 * Every Redis or serialisation failure is logged at WARN and swallowed.
 */
@Slf4j
public class RedisBugCache implements BugCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final BugCacheProperties properties;

    public RedisBugCache(StringRedisTemplate redisTemplate,
                         ObjectMapper objectMapper,
                         BugCacheProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Optional<BugResponse> getBug(UUID bugId) {
        return read(BugCacheKeys.bugKey(bugId), BugResponse.class);
    }

    @Override
    public void putBug(UUID bugId, BugResponse bug) {
        write(BugCacheKeys.bugKey(bugId), bug, properties.getBugTtl());
    }

    @Override
    public Optional<BugListResponse> getList(String listKey) {
        return read(listKey, BugListResponse.class);
    }

    @Override
    public void putList(String listKey, BugListResponse list) {
        write(listKey, list, properties.getListTtl());
    }

    @Override
    public void evictBug(UUID bugId) {
        String key = BugCacheKeys.bugKey(bugId);
        try {
            redisTemplate.delete(key);
            log.debug("Evicted cache key {}", key);
        } catch (Exception e) {
            log.warn("Cache evict failed for key {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void evictLists() {
        try {
            Set<String> keys = redisTemplate.keys(BugCacheKeys.LIST_PATTERN);
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.debug("Evicted {} list cache keys", keys.size());
            }
        } catch (Exception e) {
            log.warn("Cache evict failed for pattern {}: {}", BugCacheKeys.LIST_PATTERN, e.getMessage());
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            log.warn("Cache read failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (Exception e) {
            log.warn("Cache write failed for key {}: {}", key, e.getMessage());
        }
    }
}
