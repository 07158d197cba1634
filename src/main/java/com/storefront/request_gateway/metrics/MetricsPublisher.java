package com.storefront.request_gateway.metrics;

import com.storefront.request_gateway.accesslog.MonitoringDispatcher;
import com.storefront.request_gateway.accesslog.ThresholdAlert;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.endpoint.EndpointRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits a metrics snapshot to the monitoring sinks on a fixed schedule and raises an
 * alert for every endpoint threshold the snapshot crosses.
 */
@Component
public class MetricsPublisher {

    private final MetricsCollector collector;
    private final EndpointRegistry registry;
    private final MonitoringDispatcher dispatcher;

    public MetricsPublisher(MetricsCollector collector, EndpointRegistry registry, MonitoringDispatcher dispatcher) {
        this.collector = collector;
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    @Scheduled(fixedDelayString = "${gateway.metrics.emit-interval-ms:30000}",
               initialDelayString = "${gateway.metrics.emit-interval-ms:30000}")
    public void emit() {
        MetricsSnapshot snapshot = collector.snapshot();
        dispatcher.snapshot(snapshot);
        evaluateThresholds(snapshot).forEach(dispatcher::alert);
    }

    List<ThresholdAlert> evaluateThresholds(MetricsSnapshot snapshot) {
        List<ThresholdAlert> alerts = new ArrayList<>();
        for (EndpointDefinition endpoint : registry.definitions()) {
            AlertThresholds thresholds = endpoint.monitoring().alertThresholds();
            EndpointMetrics metrics = snapshot.endpoints().get(endpoint.key());
            if (thresholds == null || metrics == null || metrics.totalRequests() == 0) {
                continue;
            }
            if (thresholds.errorRate() != null && metrics.errorRate() > thresholds.errorRate()) {
                alerts.add(new ThresholdAlert(snapshot.timestamp(), endpoint.key(), "error_rate",
                        metrics.errorRate(), thresholds.errorRate()));
            }
            if (thresholds.responseTimeMs() != null && metrics.p95ResponseTimeMs() > thresholds.responseTimeMs()) {
                alerts.add(new ThresholdAlert(snapshot.timestamp(), endpoint.key(), "response_time",
                        metrics.p95ResponseTimeMs(), thresholds.responseTimeMs()));
            }
            if (thresholds.minThroughput() != null && metrics.throughputPerSecond() < thresholds.minThroughput()) {
                alerts.add(new ThresholdAlert(snapshot.timestamp(), endpoint.key(), "throughput",
                        metrics.throughputPerSecond(), thresholds.minThroughput()));
            }
        }
        return alerts;
    }
}
