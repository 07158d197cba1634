package com.storefront.request_gateway.accesslog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A request that ended in an error response. {@code message} is what the caller saw,
 * never internal detail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEvent(
        Instant timestamp,
        String requestId,
        String method,
        String path,
        String endpoint,
        String code,
        int statusCode,
        String message,
        String clientIp
) {}
