package com.example.bugservice.cache;

import com.example.bugservice.config.BugCacheProperties;
import com.example.bugservice.dto.response.BugResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisBugCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisBugCache cache;

    private final UUID bugId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        cache = new RedisBugCache(redisTemplate, objectMapper, new BugCacheProperties());
    }

    @Test
    void putThenGet_roundTripsThroughJsonWithBugTtl() {
        // GIVEN
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        BugResponse bug = BugResponse.builder().id(bugId).title("Login broken").voteCount(3).build();

        // WHEN
        cache.putBug(bugId, bug);

        // THEN
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("bug:" + bugId), json.capture(), eq(Duration.ofMinutes(30)));
        assertThat(json.getValue()).contains("\"vote_count\":3");

        when(valueOperations.get("bug:" + bugId)).thenReturn(json.getValue());
        assertThat(cache.getBug(bugId)).hasValueSatisfying(cached -> {
            assertThat(cached.getTitle()).isEqualTo("Login broken");
            assertThat(cached.getVoteCount()).isEqualTo(3);
        });
    }

    @Test
    void getBug_redisDown_isTreatedAsMiss() {
        // GIVEN
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        // WHEN / THEN
        assertThat(cache.getBug(bugId)).isEmpty();
    }

    @Test
    void getBug_corruptedValue_isTreatedAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("bug:" + bugId)).thenReturn("{not json");

        assertThat(cache.getBug(bugId)).isEmpty();
    }

    @Test
    void writesAndEvictions_redisDown_neverThrow() {
        // GIVEN
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(redisTemplate.delete(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(redisTemplate.keys(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        // WHEN / THEN
        assertThatNoException().isThrownBy(() -> {
            cache.putBug(bugId, BugResponse.builder().id(bugId).build());
            cache.evictBug(bugId);
            cache.evictLists();
        });
    }

    @Test
    void evictLists_deletesEveryListKey() {
        // GIVEN
        Set<String> keys = Set.of("bugs:list:a", "bugs:list:b");
        when(redisTemplate.keys("bugs:list:*")).thenReturn(keys);

        // WHEN
        cache.evictLists();

        // THEN
        verify(redisTemplate).delete(keys);
    }
}
