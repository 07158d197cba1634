package com.storefront.request_gateway.ratelimit;

/**
 * State of one fixed window. Counters are immutable; stores replace them atomically.
 */
public record RateLimitCounter(String key, int count, long windowStart, long windowMs) {

    public long windowEnd() {
        return windowStart + windowMs;
    }

    public boolean isExpired(long nowMs) {
        return nowMs >= windowEnd();
    }

    /** Milliseconds until the window closes, never below one. */
    public long remainingMs(long nowMs) {
        return Math.max(1, windowEnd() - nowMs);
    }
}
