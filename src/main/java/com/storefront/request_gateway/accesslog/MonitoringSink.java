package com.storefront.request_gateway.accesslog;

import com.storefront.request_gateway.metrics.MetricsSnapshot;

/**
 * Destination for the gateway's operational events.
 *
 * Implementations are called on request threads and the metrics scheduler and must not
 * block. A sink that throws is logged and skipped; the request is unaffected.
 */
public interface MonitoringSink {

    void publishAccessLog(AccessLogEvent event);

    void publishError(ErrorEvent event);

    void publishSnapshot(MetricsSnapshot snapshot);

    void publishAlert(ThresholdAlert alert);
}
