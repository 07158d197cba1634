package com.storefront.request_gateway.accesslog;

import com.storefront.request_gateway.metrics.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans each event out to every registered {@link MonitoringSink}. A failing sink is
 * logged at WARN and does not stop delivery to the others.
 */
@Component
public class MonitoringDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MonitoringDispatcher.class);

    private final List<MonitoringSink> sinks;

    public MonitoringDispatcher(List<MonitoringSink> sinks) {
        this.sinks = List.copyOf(sinks);
        log.info("Monitoring sinks: {}", this.sinks.stream().map(s -> s.getClass().getSimpleName()).toList());
    }

    public void accessLog(AccessLogEvent event) {
        dispatch("access log", sink -> sink.publishAccessLog(event));
    }

    public void error(ErrorEvent event) {
        dispatch("error", sink -> sink.publishError(event));
    }

    public void snapshot(MetricsSnapshot snapshot) {
        dispatch("metrics snapshot", sink -> sink.publishSnapshot(snapshot));
    }

    public void alert(ThresholdAlert alert) {
        dispatch("alert", sink -> sink.publishAlert(alert));
    }

    private void dispatch(String kind, Consumer<MonitoringSink> publish) {
        for (MonitoringSink sink : sinks) {
            try {
                publish.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Monitoring sink {} failed to publish {}: {}",
                        sink.getClass().getSimpleName(), kind, e.getMessage());
            }
        }
    }
}
