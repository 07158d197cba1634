package com.storefront.request_gateway.accesslog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable record of a single request that went through the gateway, published for
 * every request on an endpoint with request logging on, and for every unresolved path.
 *
 * {@code endpoint} is null when no endpoint matched (404). {@code errorCode} is null
 * on success.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessLogEvent(
        Instant timestamp,
        String  requestId,
        String  traceId,
        String  clientIp,
        String  method,
        String  path,
        String  endpoint,
        String  principalId,
        int     statusCode,
        long    latencyMs,
        boolean cached,
        boolean rateLimited,
        String  errorCode
) {}
