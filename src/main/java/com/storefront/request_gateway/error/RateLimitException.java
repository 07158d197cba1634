package com.storefront.request_gateway.error;

import lombok.Getter;

/**
 * The caller exceeded the endpoint's fixed-window quota.
 */
@Getter
public class RateLimitException extends GatewayException {

    private final int limit;
    private final long windowMs;
    private final long retryAfterMs;

    public RateLimitException(String message, int limit, long windowMs, long retryAfterMs) {
        super(ErrorCode.RATE_LIMIT_ERROR, message);
        this.limit = limit;
        this.windowMs = windowMs;
        this.retryAfterMs = retryAfterMs;
    }

    /**
     * Retry-after rounded up to whole seconds, never below one.
     */
    public long getRetryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }

    @Override
    protected void describe(ErrorEnvelope.ErrorEnvelopeBuilder envelope) {
        envelope.retryAfter(getRetryAfterSeconds()).limit(limit).windowMs(windowMs);
    }
}
