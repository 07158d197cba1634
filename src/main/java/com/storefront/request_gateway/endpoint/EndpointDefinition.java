package com.storefront.request_gateway.endpoint;

import com.storefront.request_gateway.auth.AuthenticationConfig;
import com.storefront.request_gateway.auth.AuthorizationConfig;
import com.storefront.request_gateway.cache.CachingConfig;
import com.storefront.request_gateway.metrics.MonitoringConfig;
import com.storefront.request_gateway.ratelimit.RateLimitConfig;
import com.storefront.request_gateway.validation.ValidationConfig;
import lombok.Builder;
import org.springframework.web.bind.annotation.RequestMethod;

import java.time.Duration;
import java.util.Objects;

/**
 * Declarative description of one gateway endpoint: where it lives, which pipeline
 * stages apply to it, and the handler that produces its response.
 *
 * {@code path} is a slash-separated pattern in which a segment starting with
 * {@code :} captures one path parameter, e.g. {@code /api/customers/:id}.
 *
 * Omitted stage configs fall back to "stage off": no validation, no authentication
 * requirement, no authorization, no caching and default monitoring. A null
 * {@code rateLimit} disables rate limiting, and a null {@code timeout} uses the
 * gateway-wide handler timeout.
 */
@Builder
public record EndpointDefinition(
        RequestMethod method,
        String path,
        String description,
        ValidationConfig validation,
        RateLimitConfig rateLimit,
        AuthenticationConfig authentication,
        AuthorizationConfig authorization,
        CachingConfig caching,
        MonitoringConfig monitoring,
        Duration timeout,
        EndpointHandler handler
) {

    public EndpointDefinition {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Endpoint path must start with '/': " + path);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("Endpoint timeout must be positive: " + timeout);
        }
        validation = validation == null ? ValidationConfig.none() : validation;
        authentication = authentication == null ? AuthenticationConfig.none() : authentication;
        authorization = authorization == null ? AuthorizationConfig.none() : authorization;
        caching = caching == null ? CachingConfig.disabled() : caching;
        monitoring = monitoring == null ? MonitoringConfig.defaults() : monitoring;
    }

    /** Registry key, e.g. {@code GET:/api/products}. */
    public String key() {
        return key(method, path);
    }

    public static String key(RequestMethod method, String path) {
        return method.name() + ":" + path;
    }
}
