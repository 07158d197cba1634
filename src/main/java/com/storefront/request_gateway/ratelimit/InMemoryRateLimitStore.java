package com.storefront.request_gateway.ratelimit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counters held in a {@link ConcurrentHashMap}. Each increment is a single
 * {@code compute} call, so concurrent requests for one key never lose an update.
 * State is per process.
 */
@Component
@ConditionalOnProperty(name = "gateway.rate-limit.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, RateLimitCounter> counters = new ConcurrentHashMap<>();

    @Override
    public RateLimitCounter increment(String key, long windowMs, long nowMs) {
        return counters.compute(key, (k, current) -> {
            if (current == null || current.isExpired(nowMs)) {
                return new RateLimitCounter(k, 1, nowMs, windowMs);
            }
            return new RateLimitCounter(k, current.count() + 1, current.windowStart(), current.windowMs());
        });
    }

    @Override
    public void release(String key, long nowMs) {
        counters.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(nowMs) || current.count() <= 0) {
                return current;
            }
            return new RateLimitCounter(k, current.count() - 1, current.windowStart(), current.windowMs());
        });
    }

    @Override
    public void reset() {
        counters.clear();
    }

    @Override
    public int purgeExpired(long nowMs) {
        int before = counters.size();
        counters.values().removeIf(counter -> counter.isExpired(nowMs));
        return Math.max(0, before - counters.size());
    }

    int size() {
        return counters.size();
    }
}
