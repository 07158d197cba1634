package com.storefront.request_gateway.metrics;

import com.storefront.request_gateway.support.MutableClock;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MetricsCollector")
class MetricsCollectorTest {

    private static final String PRODUCTS = "GET:/api/products";

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        collector = new MetricsCollector(1000, clock, meterRegistry);
    }

    @Test
    @DisplayName("p95 and p99 use the floor nearest-rank index")
    void percentiles() {
        // given 1..100 ms
        for (int ms = 1; ms <= 100; ms++) {
            collector.record(PRODUCTS, 200, ms);
        }
        clock.advance(Duration.ofSeconds(10));

        // when
        EndpointMetrics metrics = collector.snapshot().endpoints().get(PRODUCTS);

        // then sorted[95] and sorted[99]
        assertThat(metrics.p95ResponseTimeMs()).isEqualTo(96);
        assertThat(metrics.p99ResponseTimeMs()).isEqualTo(100);
        assertThat(metrics.averageResponseTimeMs()).isEqualTo(50.5);
        assertThat(metrics.throughputPerSecond()).isCloseTo(10.0, within(0.001));
    }

    @Test
    @DisplayName("2xx and 3xx count as success, everything else as failure")
    void successClassification() {
        collector.record(PRODUCTS, 200, 5);
        collector.record(PRODUCTS, 304, 5);
        collector.record(PRODUCTS, 404, 5);
        collector.record(PRODUCTS, 429, 5);
        collector.record(null, 404, 5);

        MetricsSnapshot snapshot = collector.snapshot();
        EndpointMetrics products = snapshot.endpoints().get(PRODUCTS);

        assertThat(products.successfulRequests()).isEqualTo(2);
        assertThat(products.failedRequests()).isEqualTo(2);
        assertThat(products.errorRate()).isEqualTo(0.5);
        assertThat(snapshot.global().totalRequests()).isEqualTo(5);
        assertThat(snapshot.endpoints()).containsOnlyKeys(PRODUCTS);
    }

    @Test
    @DisplayName("only the most recent samples feed the percentiles")
    void boundedSamples() {
        MetricsCollector small = new MetricsCollector(10, clock, new SimpleMeterRegistry());
        for (int i = 0; i < 10; i++) {
            small.record(PRODUCTS, 200, 1000);
        }
        for (int i = 0; i < 10; i++) {
            small.record(PRODUCTS, 200, 1);
        }

        EndpointMetrics metrics = small.snapshot().endpoints().get(PRODUCTS);

        assertThat(metrics.totalRequests()).isEqualTo(20);
        assertThat(metrics.p99ResponseTimeMs()).isEqualTo(1);
    }

    @Test
    @DisplayName("reset starts a new period")
    void reset() {
        collector.record(PRODUCTS, 500, 5);
        collector.recordRateLimitHit();
        clock.advance(Duration.ofMinutes(1));

        collector.reset();
        MetricsSnapshot snapshot = collector.snapshot();

        assertThat(snapshot.global().totalRequests()).isZero();
        assertThat(snapshot.rateLimitHits()).isZero();
        assertThat(snapshot.endpoints()).isEmpty();
        assertThat(snapshot.since()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("an empty collector reports zeros")
    void empty() {
        EndpointMetrics global = collector.snapshot().global();

        assertThat(global.endpoint()).isEqualTo(MetricsCollector.GLOBAL);
        assertThat(global.p95ResponseTimeMs()).isZero();
        assertThat(global.errorRate()).isZero();
        assertThat(global.throughputPerSecond()).isZero();
    }

    @Test
    @DisplayName("counts and latencies are published as Micrometer meters")
    void publishesMeters() {
        // given
        collector.record(PRODUCTS, 200, 40);
        collector.record(PRODUCTS, 503, 60);
        collector.recordRateLimitHit();

        // when
        double successes = meterRegistry.get("gateway.requests")
                .tags("endpoint", PRODUCTS, "outcome", "success").counter().count();
        double failures = meterRegistry.get("gateway.requests")
                .tags("endpoint", PRODUCTS, "outcome", "failure").counter().count();
        Timer latency = meterRegistry.get("gateway.request.latency").tag("endpoint", PRODUCTS).timer();

        // then
        assertThat(successes).isEqualTo(1.0);
        assertThat(failures).isEqualTo(1.0);
        assertThat(latency.count()).isEqualTo(2);
        assertThat(latency.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
        assertThat(meterRegistry.get("gateway.ratelimit.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reset unregisters the endpoint meters of the previous period")
    void resetRemovesMeters() {
        collector.record(PRODUCTS, 200, 5);

        collector.reset();

        assertThat(meterRegistry.find("gateway.requests").tag("endpoint", PRODUCTS).meters()).isEmpty();
        assertThat(meterRegistry.get("gateway.requests")
                .tags("endpoint", MetricsCollector.GLOBAL, "outcome", "success").counter().count()).isZero();
    }
}
