package com.storefront.request_gateway.ratelimit;

import lombok.Builder;

/**
 * Fixed-window quota for one endpoint: at most {@code maxRequests} per
 * {@code windowMs} for each key the resolver produces.
 *
 * The skip flags release the counted request once its outcome is known, so only
 * failed (or only successful) requests consume quota.
 */
@Builder
public record RateLimitConfig(
        long windowMs,
        int maxRequests,
        RateLimitKeyResolver keyResolver,
        boolean skipSuccessfulRequests,
        boolean skipFailedRequests
) {

    public RateLimitConfig {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        keyResolver = keyResolver == null ? RateLimitKeyResolver.clientAddress() : keyResolver;
    }

    public static RateLimitConfig of(int maxRequests, long windowMs) {
        return new RateLimitConfig(windowMs, maxRequests, null, false, false);
    }
}
