package com.storefront.request_gateway.accesslog;

import com.storefront.request_gateway.config.GatewayProperties;
import com.storefront.request_gateway.metrics.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes monitoring events to Kafka as JSON.
 *
 * Fire-and-forget: sends are not awaited. If Kafka is unavailable the failure is
 * logged at WARN and the request is unaffected.
 *
 * Topics (configurable under {@code gateway.monitoring.kafka}):
 *   gateway.access-logs  key = client IP, so one client's events stay ordered
 *   gateway.errors       key = request id
 *   gateway.metrics      key = "global"
 *   gateway.alerts       key = endpoint
 */
@Component
@ConditionalOnProperty(name = "gateway.monitoring.kafka.enabled", havingValue = "true")
public class KafkaMonitoringSink implements MonitoringSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaMonitoringSink.class);

    private final KafkaTemplate<String, Object> kafka;
    private final GatewayProperties.Kafka topics;

    public KafkaMonitoringSink(KafkaTemplate<String, Object> kafka, GatewayProperties properties) {
        this.kafka = kafka;
        this.topics = properties.getMonitoring().getKafka();
    }

    @Override
    public void publishAccessLog(AccessLogEvent event) {
        send(topics.getAccessLogTopic(), event.clientIp(), event);
    }

    @Override
    public void publishError(ErrorEvent event) {
        send(topics.getErrorsTopic(), event.requestId(), event);
    }

    @Override
    public void publishSnapshot(MetricsSnapshot snapshot) {
        send(topics.getMetricsTopic(), "global", snapshot);
    }

    @Override
    public void publishAlert(ThresholdAlert alert) {
        send(topics.getAlertsTopic(), alert.endpoint(), alert);
    }

    private void send(String topic, String key, Object payload) {
        kafka.send(topic, key, payload)
             .exceptionally(ex -> {
                 log.warn("Kafka publish to {} failed: {}", topic, ex.getMessage());
                 return null;
             });
    }
}
