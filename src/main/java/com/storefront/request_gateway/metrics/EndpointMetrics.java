package com.storefront.request_gateway.metrics;

/**
 * Derived figures for one endpoint, or for the whole gateway.
 *
 * Latency figures cover only the retained samples; counters cover everything since
 * start or the last reset.
 */
public record EndpointMetrics(
        String endpoint,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double averageResponseTimeMs,
        long p95ResponseTimeMs,
        long p99ResponseTimeMs,
        double errorRate,
        double throughputPerSecond
) {}
