package com.moddock.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client rate limit buckets (Bucket4j).
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final long defaultPerMinute;
    private final long strictPerMinute;
    private final int maxTrackedClients;

    public RateLimitConfig(
            @Value("${moddock.rate-limit.default-per-minute:100}") long defaultPerMinute,
            @Value("${moddock.rate-limit.strict-per-minute:20}") long strictPerMinute,
            @Value("${moddock.rate-limit.max-tracked-clients:10000}") int maxTrackedClients) {
        this.defaultPerMinute = defaultPerMinute;
        this.strictPerMinute = strictPerMinute;
        this.maxTrackedClients = maxTrackedClients;
    }

    public Bucket resolveBucket(String clientId) {
        return resolve(clientId, defaultPerMinute);
    }

    /**
     * Tighter limit for deletions and token management.
     */
    public Bucket resolveStrictBucket(String clientId) {
        return resolve(clientId + ":strict", strictPerMinute);
    }

    int trackedClients() {
        return buckets.size();
    }

    private Bucket resolve(String key, long perMinute) {
        Bucket existing = buckets.get(key);
        if (existing != null) {
            return existing;
        }
        if (buckets.size() >= maxTrackedClients) {
            evictIdle();
        }
        return buckets.computeIfAbsent(key, k -> createBucket(perMinute));
    }

    /**
     * Drops buckets that have refilled to capacity; a fresh bucket behaves the same.
     * When every tracked client is mid-window the map is cleared outright.
     */
    private synchronized void evictIdle() {
        if (buckets.size() < maxTrackedClients) {
            return;
        }
        int before = buckets.size();
        buckets.entrySet().removeIf(entry -> {
            long capacity = entry.getKey().endsWith(":strict") ? strictPerMinute : defaultPerMinute;
            return entry.getValue().getAvailableTokens() >= capacity;
        });
        if (buckets.size() >= maxTrackedClients) {
            log.warn("Rate limit table full with {} active clients, resetting", buckets.size());
            buckets.clear();
        }
        log.debug("Evicted {} idle rate limit buckets", before - buckets.size());
    }

    private Bucket createBucket(long perMinute) {
        Bandwidth limit = Bandwidth.builder()
                .capacity(perMinute)
                .refillGreedy(perMinute, Duration.ofMinutes(1))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }
}
