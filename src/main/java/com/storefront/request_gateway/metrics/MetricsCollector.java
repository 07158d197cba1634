package com.storefront.request_gateway.metrics;

import com.storefront.request_gateway.config.GatewayProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request counters and latency distribution, globally and per endpoint.
 *
 * A request counts as successful when its final status is 200-399; everything else,
 * including rejections by the pipeline itself, counts as failed.
 *
 * Counters and timers are registered with the {@link MeterRegistry} under
 * {@code gateway.requests}, {@code gateway.request.latency} and
 * {@code gateway.ratelimit.rejected}; percentiles come from a bounded sample ring per
 * scope. Recording never blocks on other endpoints; each ring synchronizes on itself.
 */
@Component
public class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    public static final String GLOBAL = "global";

    static final String RATE_LIMIT_REJECTED = "gateway.ratelimit.rejected";

    private final int sampleCapacity;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private volatile RequestStats global;
    private volatile Map<String, RequestStats> endpoints = new ConcurrentHashMap<>();
    private volatile Counter rateLimitHits;
    private volatile Instant since;

    @Autowired
    public MetricsCollector(GatewayProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this(properties.getMetrics().getSampleCapacity(), clock, meterRegistry);
    }

    public MetricsCollector(int sampleCapacity, Clock clock, MeterRegistry meterRegistry) {
        this.sampleCapacity = sampleCapacity;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.global = new RequestStats(meterRegistry, GLOBAL, sampleCapacity);
        this.rateLimitHits = rateLimitCounter();
        this.since = clock.instant();
    }

    private Counter rateLimitCounter() {
        return Counter.builder(RATE_LIMIT_REJECTED)
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry);
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 400;
    }

    /**
     * Records one completed request.
     *
     * @param endpointKey endpoint the request resolved to; null when it did not resolve
     *                    or the endpoint opted out of endpoint-scoped metrics
     */
    public void record(String endpointKey, int status, long latencyMs) {
        boolean success = isSuccess(status);
        global.record(success, latencyMs);
        if (endpointKey != null) {
            endpoints.computeIfAbsent(endpointKey, key -> new RequestStats(meterRegistry, key, sampleCapacity))
                    .record(success, latencyMs);
        }
    }

    public void recordRateLimitHit() {
        rateLimitHits.increment();
    }

    public MetricsSnapshot snapshot() {
        Instant now = clock.instant();
        Instant start = since;
        double elapsedSeconds = Duration.between(start, now).toMillis() / 1000.0;

        Map<String, EndpointMetrics> perEndpoint = new LinkedHashMap<>();
        endpoints.forEach((key, stats) -> perEndpoint.put(key, stats.snapshot(key, elapsedSeconds)));

        return new MetricsSnapshot(
                now,
                start,
                global.snapshot(GLOBAL, elapsedSeconds),
                (long) rateLimitHits.count(),
                perEndpoint);
    }

    /**
     * Starts a new measurement period. Requests recorded concurrently with a reset may
     * land in either period.
     */
    public void reset() {
        global.remove();
        endpoints.values().forEach(RequestStats::remove);
        meterRegistry.remove(rateLimitHits);

        this.global = new RequestStats(meterRegistry, GLOBAL, sampleCapacity);
        this.endpoints = new ConcurrentHashMap<>();
        this.rateLimitHits = rateLimitCounter();
        this.since = clock.instant();
        log.info("Metrics reset");
    }
}
