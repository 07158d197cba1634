package com.storefront.request_gateway.gateway;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A request as it arrives from the transport, before any parsing or validation.
 *
 * Header names are lower-cased on construction. {@code remoteAddress} may be null
 * when the transport cannot supply one.
 */
@Builder
public record RawRequest(
        String method,
        String path,
        String url,
        Map<String, String> query,
        Map<String, String> headers,
        String body,
        String remoteAddress
) {

    public RawRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        method = method.toUpperCase(Locale.ROOT);
        query = query == null ? Map.of() : Map.copyOf(query);
        Map<String, String> lowered = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> lowered.put(name.toLowerCase(Locale.ROOT), value));
        }
        headers = Map.copyOf(lowered);
        url = url == null ? path : url;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
