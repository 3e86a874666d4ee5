package com.flagship.practice_analytics.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for analytics operations.
 *
 * Metrics exposed:
 * - analytics.cache: cache lookups tagged by cache name and result (hit/miss/error)
 * - analytics.generation.duration: time to build a result, tagged by operation and scope
 * - analytics.transactions.processed: transactions read per operation
 * - analytics.downsample.ratio: output/input size of downsampled series
 */
@Component
public class AnalyticsMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary downsampleRatio;

    public AnalyticsMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.downsampleRatio = DistributionSummary.builder("analytics.downsample.ratio")
                .description("Points kept divided by points received when downsampling a daily series")
                .register(registry);
    }

    // ==================== Cache ====================

    public void recordCacheHit(String cacheName) {
        registry.counter("analytics.cache", "cache", sanitizeTag(cacheName), "result", "hit").increment();
    }

    public void recordCacheMiss(String cacheName) {
        registry.counter("analytics.cache", "cache", sanitizeTag(cacheName), "result", "miss").increment();
    }

    public void recordCacheError(String cacheName) {
        registry.counter("analytics.cache", "cache", sanitizeTag(cacheName), "result", "error").increment();
    }

    // ==================== Generation ====================

    /**
     * Records how long it took to build an analytics result.
     */
    public void recordGenerationLatency(String operation, String scopeType, long durationMs) {
        Timer.builder("analytics.generation.duration")
                .tag("operation", sanitizeTag(operation))
                .tag("scope", sanitizeTag(scopeType))
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordTransactionsProcessed(String operation, int count) {
        registry.counter("analytics.transactions.processed", "operation", sanitizeTag(operation))
                .increment(count);
    }

    public void recordDownsample(int inputPoints, int outputPoints) {
        if (inputPoints > 0) {
            downsampleRatio.record((double) outputPoints / inputPoints);
        }
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
