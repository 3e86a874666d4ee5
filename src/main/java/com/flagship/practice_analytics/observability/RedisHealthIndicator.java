package com.flagship.practice_analytics.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health of the Redis result cache.
 *
 * The service works without Redis (results are computed on every call), so an
 * unreachable Redis is DEGRADED rather than DOWN.
 */
@Component("analyticsCacheHealth")
public class RedisHealthIndicator implements HealthIndicator {

    private static final String NOTE = "Analytics are computed without caching while Redis is unavailable";

    private final StringRedisTemplate redisTemplate;

    public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Health health() {
        RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
        if (connectionFactory == null) {
            return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", NOTE)
                    .build();
        }

        try (RedisConnection connection = connectionFactory.getConnection()) {
            String result = connection.ping();
            if ("PONG".equals(result)) {
                return Health.up()
                        .withDetail("response", result)
                        .build();
            }
            return Health.status("DEGRADED")
                    .withDetail("response", result != null ? result : "null")
                    .withDetail("note", NOTE)
                    .build();

        } catch (Exception e) {
            return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", NOTE)
                    .build();
        }
    }
}
