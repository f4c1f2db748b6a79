package com.regencredit.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account rate limits using Bucket4j.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * Default rate limit: 100 requests per minute per client.
     */
    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(100));
    }

    /**
     * Votes, delations and withdrawals: 10 requests per minute.
     */
    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> createBucket(10));
    }

    /**
     * Reads: 500 requests per minute.
     */
    public Bucket resolveHighVolumeBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":high", key -> createBucket(500));
    }

    private Bucket createBucket(long perMinute) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clear rate limit buckets for a client (for testing).
     */
    public void clearBucket(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":strict");
        buckets.remove(clientId + ":high");
    }
}
