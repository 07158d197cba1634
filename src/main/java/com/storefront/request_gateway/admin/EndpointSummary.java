package com.storefront.request_gateway.admin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storefront.request_gateway.auth.AuthMethod;
import com.storefront.request_gateway.endpoint.EndpointDefinition;

import java.util.List;

/**
 * Admin-API view of a registered endpoint. Handlers and request types are not exposed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EndpointSummary(
        String key,
        String method,
        String path,
        String description,
        boolean authenticationRequired,
        List<String> authMethods,
        List<String> requiredRoles,
        List<String> requiredPermissions,
        Integer rateLimitMaxRequests,
        Long rateLimitWindowMs,
        Long cacheTtlMs,
        Long timeoutMs
) {

    static EndpointSummary from(EndpointDefinition endpoint) {
        return new EndpointSummary(
                endpoint.key(),
                endpoint.method().name(),
                endpoint.path(),
                endpoint.description(),
                endpoint.authentication().required(),
                endpoint.authentication().methods().stream().map(AuthMethod::label).toList(),
                endpoint.authorization().roles(),
                endpoint.authorization().permissions(),
                endpoint.rateLimit() == null ? null : endpoint.rateLimit().maxRequests(),
                endpoint.rateLimit() == null ? null : endpoint.rateLimit().windowMs(),
                endpoint.caching().enabled() ? endpoint.caching().ttlMs() : null,
                endpoint.timeout() == null ? null : endpoint.timeout().toMillis());
    }
}
