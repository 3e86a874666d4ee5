package com.flagship.practice_analytics.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.practice_analytics.observability.AnalyticsMetrics;
import com.flagship.practice_analytics.scope.AnalyticsScope;
import com.flagship.practice_analytics.wip.Resolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Best-effort Redis cache for analytics results.
 *
 * Results are plain JSON values keyed by scope, window and resolution. Redis is
 * optional: when it is missing, disabled or failing, lookups miss and writes are
 * skipped, and callers compute the result as usual.
 */
@Component
@Slf4j
public class AnalyticsCache {

    private static final String KEY_PREFIX = "analytics:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final AnalyticsMetrics metrics;
    private final Duration ttl;
    private final boolean enabled;

    public AnalyticsCache(Optional<StringRedisTemplate> redisTemplate,
                          ObjectMapper objectMapper,
                          AnalyticsMetrics metrics,
                          @Value("${analytics.cache.ttl-seconds:600}") long ttlSeconds,
                          @Value("${analytics.cache.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.enabled = enabled;
    }

    public static String graphKey(AnalyticsScope scope, Resolution resolution) {
        return KEY_PREFIX + "graphs:" + scope.key() + ":" + resolution.paramValue();
    }

    public static String debtorsKey(AnalyticsScope scope) {
        return KEY_PREFIX + "debtors:" + scope.key();
    }

    /**
     * Looks up a cached value.
     *
     * @return the cached value, or empty on a miss or any cache failure
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        if (!isActive()) {
            return Optional.empty();
        }

        String cacheName = cacheName(key);
        try {
            String json = redisTemplate.get().opsForValue().get(key);
            if (json == null) {
                metrics.recordCacheMiss(cacheName);
                return Optional.empty();
            }
            metrics.recordCacheHit(cacheName);
            log.debug("Analytics cache hit: {}", key);
            return Optional.of(objectMapper.readValue(json, type));

        } catch (JsonProcessingException e) {
            metrics.recordCacheError(cacheName);
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        } catch (Exception e) {
            metrics.recordCacheError(cacheName);
            log.warn("Analytics cache lookup failed for {}. Computing without cache. Error: {}",
                    key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores a value with the configured TTL. Failures are logged, never thrown.
     */
    public void put(String key, Object value) {
        if (!isActive()) {
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.get().opsForValue().set(key, json, ttl);
            log.debug("Stored analytics result in cache: {} (ttl={})", key, ttl);
        } catch (Exception e) {
            metrics.recordCacheError(cacheName(key));
            log.warn("Failed to store analytics result in cache: {}. Error: {}", key, e.getMessage());
        }
    }

    private boolean isActive() {
        return enabled && redisTemplate.isPresent();
    }

    private static String cacheName(String key) {
        String withoutPrefix = key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
        int separator = withoutPrefix.indexOf(':');
        return separator > 0 ? withoutPrefix.substring(0, separator) : withoutPrefix;
    }
}
