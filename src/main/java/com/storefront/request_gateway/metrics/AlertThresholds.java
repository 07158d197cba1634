package com.storefront.request_gateway.metrics;

/**
 * Limits that raise a {@link com.storefront.request_gateway.accesslog.ThresholdAlert}
 * when crossed. A null limit is not checked.
 *
 * @param errorRate      alert when the error rate is above this fraction (0.0-1.0)
 * @param responseTimeMs alert when p95 latency is above this
 * @param minThroughput  alert when requests per second fall below this
 */
public record AlertThresholds(Double errorRate, Long responseTimeMs, Double minThroughput) {}
