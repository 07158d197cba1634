package com.storefront.request_gateway.accesslog;

import com.storefront.request_gateway.metrics.EndpointMetrics;
import com.storefront.request_gateway.metrics.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every monitoring event to the application log. Always active.
 */
@Component
public class LoggingMonitoringSink implements MonitoringSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingMonitoringSink.class);

    @Override
    public void publishAccessLog(AccessLogEvent event) {
        log.info("{} {} -> {} {}ms cached={} client={} requestId={}",
                event.method(), event.path(), event.statusCode(), event.latencyMs(),
                event.cached(), event.clientIp(), event.requestId());
    }

    @Override
    public void publishError(ErrorEvent event) {
        if (event.statusCode() >= 500) {
            log.error("{} {} failed with {} ({}) requestId={}",
                    event.method(), event.path(), event.statusCode(), event.code(), event.requestId());
        } else {
            log.debug("{} {} rejected with {} ({}): {} requestId={}",
                    event.method(), event.path(), event.statusCode(), event.code(), event.message(),
                    event.requestId());
        }
    }

    @Override
    public void publishSnapshot(MetricsSnapshot snapshot) {
        EndpointMetrics global = snapshot.global();
        log.info("Metrics: total={} failed={} errorRate={} avg={}ms p95={}ms p99={}ms rps={} rateLimitHits={}",
                global.totalRequests(), global.failedRequests(),
                String.format("%.3f", global.errorRate()),
                String.format("%.1f", global.averageResponseTimeMs()),
                global.p95ResponseTimeMs(), global.p99ResponseTimeMs(),
                String.format("%.2f", global.throughputPerSecond()),
                snapshot.rateLimitHits());
    }

    @Override
    public void publishAlert(ThresholdAlert alert) {
        log.warn("Alert {} on {}: value={} threshold={}",
                alert.metric(), alert.endpoint(), alert.value(), alert.threshold());
    }
}
