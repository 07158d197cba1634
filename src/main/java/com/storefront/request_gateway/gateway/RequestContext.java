package com.storefront.request_gateway.gateway;

import java.time.Instant;

/**
 * Per-call facts about the caller, created once when the request enters the
 * gateway and passed unchanged to every stage and to the handler.
 *
 * @param clientAddress may be null when no address could be determined
 * @param origin        may be null
 */
public record RequestContext(
        String requestId,
        Instant timestamp,
        String clientAddress,
        String userAgent,
        String origin,
        CorrelationContext correlation
) {}
