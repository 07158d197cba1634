package com.storefront.request_gateway.gateway;

/**
 * Distributed-tracing identifiers, taken from {@code x-trace-id}, {@code x-span-id}
 * and {@code x-parent-span-id} or generated when absent.
 *
 * @param parentSpanId may be null
 */
public record CorrelationContext(String traceId, String spanId, String parentSpanId) {}
