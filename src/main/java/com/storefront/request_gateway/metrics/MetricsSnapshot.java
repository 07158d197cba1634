package com.storefront.request_gateway.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of the collector at {@code timestamp}.
 *
 * @param since     start of the measured period (startup or last reset)
 * @param endpoints per-endpoint figures keyed by {@code METHOD:path}
 */
public record MetricsSnapshot(
        Instant timestamp,
        Instant since,
        EndpointMetrics global,
        long rateLimitHits,
        Map<String, EndpointMetrics> endpoints
) {

    public MetricsSnapshot {
        endpoints = Map.copyOf(endpoints);
    }
}
