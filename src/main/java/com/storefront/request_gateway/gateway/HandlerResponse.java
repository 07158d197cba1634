package com.storefront.request_gateway.gateway;

import java.util.Map;

/**
 * What an endpoint handler returns. {@code body} must be serializable by Jackson.
 */
public record HandlerResponse(int status, Map<String, String> headers, Object body) {

    public HandlerResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HandlerResponse ok(Object body) {
        return new HandlerResponse(200, Map.of(), body);
    }

    public static HandlerResponse created(Object body) {
        return new HandlerResponse(201, Map.of(), body);
    }

    public static HandlerResponse of(int status, Object body) {
        return new HandlerResponse(status, Map.of(), body);
    }

    public boolean isError() {
        return status >= 400;
    }
}
