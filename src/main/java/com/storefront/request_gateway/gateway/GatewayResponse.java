package com.storefront.request_gateway.gateway;

import java.util.Map;

/**
 * Final result of {@link GatewayOrchestrator#handleRequest}. On failure {@code body}
 * is an {@link com.storefront.request_gateway.error.ErrorEnvelope}.
 */
public record GatewayResponse(int status, Map<String, String> headers, Object body, ResponseMetadata metadata) {

    public GatewayResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isError() {
        return status >= 400;
    }
}
