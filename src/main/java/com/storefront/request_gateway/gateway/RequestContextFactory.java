package com.storefront.request_gateway.gateway;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates the {@link RequestContext} for an inbound request.
 *
 * Trace and span ids are taken from {@code x-trace-id} / {@code x-span-id} when the
 * caller supplies them and generated otherwise.
 */
@Component
public class RequestContextFactory {

    private final Clock clock;

    public RequestContextFactory(Clock clock) {
        this.clock = clock;
    }

    public RequestContext create(RawRequest request) {
        String traceId = request.header("x-trace-id");
        String spanId = request.header("x-span-id");
        CorrelationContext correlation = new CorrelationContext(
                isBlank(traceId) ? UUID.randomUUID().toString().replace("-", "") : traceId,
                isBlank(spanId) ? UUID.randomUUID().toString().replace("-", "").substring(0, 16) : spanId,
                request.header("x-parent-span-id"));

        return new RequestContext(
                "req_" + UUID.randomUUID(),
                clock.instant(),
                extractClientIp(request),
                request.header("user-agent") == null ? "" : request.header("user-agent"),
                request.header("origin"),
                correlation);
    }

    /**
     * Extracts the originating client IP address.
     *
     * Behind a reverse proxy or load balancer the client IP arrives in X-Forwarded-For,
     * possibly as a chain ("client, proxy1, proxy2") whose first entry is the client.
     * X-Real-IP is the single-address variant some proxies set instead. The transport's
     * remote address is the last resort and may itself be missing.
     */
    static String extractClientIp(RawRequest request) {
        String forwarded = request.header("x-forwarded-for");
        if (!isBlank(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.header("x-real-ip");
        if (!isBlank(realIp)) {
            return realIp.trim();
        }
        return isBlank(request.remoteAddress()) ? null : request.remoteAddress();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
