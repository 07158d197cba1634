package com.storefront.request_gateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Meters and latency ring for one scope (one endpoint, or global).
 *
 * Counts live in Micrometer meters tagged {@code endpoint=<scope>}; the ring keeps the
 * samples the percentiles are computed from. {@link #remove()} unregisters the meters
 * when the collector starts a new period.
 */
class RequestStats {

    static final String REQUESTS = "gateway.requests";
    static final String LATENCY = "gateway.request.latency";

    private final MeterRegistry registry;
    private final Counter successful;
    private final Counter failed;
    private final Timer latency;
    private final LatencyRing latencies;

    RequestStats(MeterRegistry registry, String scope, int sampleCapacity) {
        this.registry = registry;
        this.successful = Counter.builder(REQUESTS)
                .description("Completed requests by outcome")
                .tag("endpoint", scope)
                .tag("outcome", "success")
                .register(registry);
        this.failed = Counter.builder(REQUESTS)
                .description("Completed requests by outcome")
                .tag("endpoint", scope)
                .tag("outcome", "failure")
                .register(registry);
        this.latency = Timer.builder(LATENCY)
                .tag("endpoint", scope)
                .register(registry);
        this.latencies = new LatencyRing(sampleCapacity);
    }

    void record(boolean success, long latencyMs) {
        (success ? successful : failed).increment();
        latency.record(latencyMs, TimeUnit.MILLISECONDS);
        latencies.record(latencyMs);
    }

    EndpointMetrics snapshot(String name, double elapsedSeconds) {
        long successCount = (long) successful.count();
        long failedCount = (long) failed.count();
        long totalCount = successCount + failedCount;
        long[] sorted = latencies.sortedSnapshot();
        return new EndpointMetrics(
                name,
                totalCount,
                successCount,
                failedCount,
                LatencyRing.average(sorted),
                LatencyRing.percentile(sorted, 0.95),
                LatencyRing.percentile(sorted, 0.99),
                totalCount == 0 ? 0.0 : (double) failedCount / totalCount,
                elapsedSeconds <= 0 ? 0.0 : totalCount / elapsedSeconds);
    }

    void remove() {
        List.of(successful, failed, latency).forEach(registry::remove);
    }
}
