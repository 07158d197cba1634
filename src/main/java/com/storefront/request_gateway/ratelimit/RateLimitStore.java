package com.storefront.request_gateway.ratelimit;

/**
 * Where fixed-window counters live. Implementations must make {@link #increment}
 * atomic per key.
 */
public interface RateLimitStore {

    /**
     * Counts one request against {@code key}. Starts a new window when none exists or
     * the current one has elapsed.
     *
     * @return the counter after this request was counted
     */
    RateLimitCounter increment(String key, long windowMs, long nowMs);

    /** Gives back one counted request, if its window is still open. */
    void release(String key, long nowMs);

    /** Drops every counter. */
    void reset();

    /** Removes elapsed windows and returns how many were removed. */
    int purgeExpired(long nowMs);
}
