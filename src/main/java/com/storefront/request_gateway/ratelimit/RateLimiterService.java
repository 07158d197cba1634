package com.storefront.request_gateway.ratelimit;

import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.error.RateLimitException;
import com.storefront.request_gateway.gateway.RawRequest;
import com.storefront.request_gateway.gateway.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Fixed-window rate limiter applied per endpoint.
 *
 * Each (endpoint, client key) pair has its own counter in the {@link RateLimitStore}.
 * The request that pushes the count past the endpoint's maximum is rejected with
 * the time left in the window as its retry-after. The first request after the window
 * closes starts a new one at count 1.
 *
 * A fixed window lets a client send up to twice the maximum across a window
 * boundary.
 *
 * Key format: {@code METHOD:/path|clientKey}
 * Example:    {@code GET:/api/products|192.168.1.10}
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    /**
     * Outcome of an allowed check.
     *
     * @param key       the counter key, null when the endpoint has no rate limit
     * @param limit     the endpoint maximum; -1 when rate limiting is off
     * @param remaining requests left in the current window; -1 when rate limiting is off
     */
    public record RateLimitDecision(String key, int limit, int remaining, RateLimitConfig config) {

        private static final RateLimitDecision UNLIMITED = new RateLimitDecision(null, -1, -1, null);

        public static RateLimitDecision unlimited() {
            return UNLIMITED;
        }

        public boolean isLimited() {
            return config != null;
        }
    }

    private final RateLimitStore store;
    private final Clock clock;

    public RateLimiterService(RateLimitStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Counts the request and decides whether it may proceed.
     *
     * @throws RateLimitException when the client has used up the endpoint's window
     */
    public RateLimitDecision check(EndpointDefinition endpoint, RawRequest request, RequestContext context) {
        RateLimitConfig config = endpoint.rateLimit();
        if (config == null) {
            return RateLimitDecision.unlimited();
        }

        String key = endpoint.key() + "|" + config.keyResolver().resolve(request, context);
        long nowMs = clock.millis();
        RateLimitCounter counter = store.increment(key, config.windowMs(), nowMs);

        if (counter.count() > config.maxRequests()) {
            long retryAfterMs = counter.remainingMs(nowMs);
            log.warn("Rate limit exceeded key={} count={} limit={} retryAfterMs={}",
                    key, counter.count(), config.maxRequests(), retryAfterMs);
            throw new RateLimitException(
                    "Too many requests, retry in " + Math.max(1, (retryAfterMs + 999) / 1000) + "s",
                    config.maxRequests(),
                    config.windowMs(),
                    retryAfterMs);
        }

        return new RateLimitDecision(key, config.maxRequests(),
                Math.max(0, config.maxRequests() - counter.count()), config);
    }

    /**
     * Called once the response status is known. Gives the counted request back when the
     * endpoint skips that kind of outcome.
     */
    public void complete(RateLimitDecision decision, int status) {
        if (!decision.isLimited()) {
            return;
        }
        boolean failed = status >= 400;
        RateLimitConfig config = decision.config();
        if (failed && config.skipFailedRequests() || !failed && config.skipSuccessfulRequests()) {
            store.release(decision.key(), clock.millis());
        }
    }

    public void reset() {
        store.reset();
        log.info("Rate limit counters reset");
    }

    /**
     * Drops elapsed windows so idle clients do not accumulate.
     * fixedDelay, so a slow purge never overlaps the next one.
     */
    @Scheduled(fixedDelayString = "${gateway.rate-limit.purge-interval-ms:60000}")
    public void purgeExpired() {
        int removed = store.purgeExpired(clock.millis());
        if (removed > 0) {
            log.debug("Purged {} expired rate-limit counters", removed);
        }
    }
}
