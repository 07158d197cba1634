package com.storefront.request_gateway.accesslog;

import java.time.Instant;

/**
 * An endpoint crossed one of its alert thresholds.
 *
 * @param metric {@code error_rate}, {@code response_time} or {@code throughput}
 */
public record ThresholdAlert(Instant timestamp, String endpoint, String metric, double value, double threshold) {}
