package com.storefront.request_gateway.metrics;

/**
 * Observability switches for one endpoint.
 *
 * @param logRequests     write an access-log line and publish an access event per request
 * @param logResponses    log the response body size at debug
 * @param trackMetrics    record endpoint-scoped metrics (global metrics are always recorded)
 * @param alertThresholds may be null
 */
public record MonitoringConfig(
        boolean logRequests,
        boolean logResponses,
        boolean trackMetrics,
        AlertThresholds alertThresholds
) {

    public static MonitoringConfig defaults() {
        return new MonitoringConfig(true, false, true, null);
    }

    public static MonitoringConfig withAlerts(AlertThresholds thresholds) {
        return new MonitoringConfig(true, false, true, thresholds);
    }
}
