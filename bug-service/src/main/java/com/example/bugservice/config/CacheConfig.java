package com.example.bugservice.config;

import com.example.bugservice.cache.BugCache;
import com.example.bugservice.cache.NoOpBugCache;
import com.example.bugservice.cache.RedisBugCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the Redis cache, or the no-op one when caching is disabled.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public BugCache bugCache(BugCacheProperties properties,
                             ObjectProvider<StringRedisTemplate> redisTemplate,
                             ObjectMapper objectMapper) {
        if (!properties.isEnabled()) {
            log.info("Bug cache disabled, using no-op cache");
            return new NoOpBugCache();
        }
        log.info("Bug cache enabled: bugTtl={}, listTtl={}", properties.getBugTtl(), properties.getListTtl());
        return new RedisBugCache(redisTemplate.getObject(), objectMapper, properties);
    }
}
