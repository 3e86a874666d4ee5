package com.flagship.practice_analytics.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.practice_analytics.config.JacksonConfig;
import com.flagship.practice_analytics.observability.AnalyticsMetrics;
import com.flagship.practice_analytics.scope.AnalyticsScope;
import com.flagship.practice_analytics.wip.AggregateSummary;
import com.flagship.practice_analytics.wip.DailyMetric;
import com.flagship.practice_analytics.wip.Resolution;
import com.flagship.practice_analytics.wip.WipGraphData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalyticsCacheTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private SimpleMeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private AnalyticsCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new JacksonConfig().objectMapper();
        cache = new AnalyticsCache(Optional.of(redisTemplate), objectMapper,
            new AnalyticsMetrics(meterRegistry), 600, true);
    }

    private static WipGraphData graph() {
        return WipGraphData.builder()
            .dailyMetrics(List.of(DailyMetric.builder()
                .date(LocalDate.of(2024, 3, 1))
                .production(new BigDecimal("10.50"))
                .adjustments(BigDecimal.ZERO)
                .disbursements(BigDecimal.ZERO)
                .billing(BigDecimal.ZERO)
                .provisions(BigDecimal.ZERO)
                .wipBalance(new BigDecimal("110.50"))
                .build()))
            .summary(AggregateSummary.builder()
                .totalProduction(new BigDecimal("10.50"))
                .totalAdjustments(BigDecimal.ZERO)
                .totalDisbursements(BigDecimal.ZERO)
                .totalBilling(BigDecimal.ZERO)
                .totalProvisions(BigDecimal.ZERO)
                .currentWipBalance(new BigDecimal("110.50"))
                .build())
            .build();
    }

    private double cacheCount(String result) {
        return meterRegistry.counter("analytics.cache", "cache", "graphs", "result", result).count();
    }

    @Test
    @DisplayName("Keys follow analytics:{kind}:{scope}:{id}[:{resolution}]")
    void testKeys() {
        UUID clientId = UUID.fromString("00000000-0000-0000-0000-000000000001");

        assertEquals("analytics:graphs:client:00000000-0000-0000-0000-000000000001:low",
            AnalyticsCache.graphKey(AnalyticsScope.client(clientId), Resolution.LOW));
        assertEquals("analytics:graphs:group:GRP1:standard",
            AnalyticsCache.graphKey(AnalyticsScope.group("GRP1"), Resolution.STANDARD));
        assertEquals("analytics:debtors:client:00000000-0000-0000-0000-000000000001",
            AnalyticsCache.debtorsKey(AnalyticsScope.client(clientId)));
    }

    @Test
    @DisplayName("Stored values are written as JSON with the configured TTL and read back equal")
    void testPutThenGet() {
        String key = "analytics:graphs:task:abc:high";
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);

        cache.put(key, graph());

        verify(valueOperations).set(eq(key), json.capture(), eq(Duration.ofSeconds(600)));
        assertTrue(json.getValue().contains("\"date\":\"2024-03-01\""));

        when(valueOperations.get(key)).thenReturn(json.getValue());
        Optional<WipGraphData> cached = cache.get(key, WipGraphData.class);

        assertTrue(cached.isPresent());
        assertEquals(graph(), cached.get());
        assertEquals(1.0, cacheCount("hit"));
    }

    @Test
    @DisplayName("A missing key is a miss")
    void testMiss() {
        when(valueOperations.get(anyString())).thenReturn(null);

        assertTrue(cache.get("analytics:graphs:client:x:low", WipGraphData.class).isEmpty());
        assertEquals(1.0, cacheCount("miss"));
    }

    @Test
    @DisplayName("Redis failures and unreadable entries fall back to an empty result")
    void testFailuresAreSwallowed() {
        when(valueOperations.get("analytics:graphs:client:down:low"))
            .thenThrow(new RedisConnectionFailureException("Connection refused"));
        when(valueOperations.get("analytics:graphs:client:corrupt:low")).thenReturn("{not json");
        doThrow(new RedisConnectionFailureException("Connection refused"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertTrue(cache.get("analytics:graphs:client:down:low", WipGraphData.class).isEmpty());
        assertTrue(cache.get("analytics:graphs:client:corrupt:low", WipGraphData.class).isEmpty());
        assertDoesNotThrow(() -> cache.put("analytics:graphs:client:down:low", graph()));
        assertEquals(3.0, cacheCount("error"));
    }

    @Test
    @DisplayName("Disabled or absent Redis never touches the template")
    void testInactiveCache() {
        AnalyticsCache disabled = new AnalyticsCache(Optional.of(redisTemplate), objectMapper,
            new AnalyticsMetrics(meterRegistry), 600, false);
        AnalyticsCache absent = new AnalyticsCache(Optional.empty(), objectMapper,
            new AnalyticsMetrics(meterRegistry), 600, true);

        assertTrue(disabled.get("analytics:graphs:client:x:low", WipGraphData.class).isEmpty());
        disabled.put("analytics:graphs:client:x:low", graph());
        assertTrue(absent.get("analytics:graphs:client:x:low", WipGraphData.class).isEmpty());
        absent.put("analytics:graphs:client:x:low", graph());

        verifyNoInteractions(valueOperations);
    }
}
