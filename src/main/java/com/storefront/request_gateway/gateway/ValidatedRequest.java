package com.storefront.request_gateway.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storefront.request_gateway.auth.Principal;
import com.storefront.request_gateway.auth.Session;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The request after validation, as handlers see it.
 *
 * {@code params} and {@code query} hold the bound request types written back as
 * JSON (coerced values and defaults applied). {@code principal} and {@code session} are null until the
 * authenticator derives a copy through {@link #withAuthentication}.
 */
public record ValidatedRequest(
        RequestMethod method,
        String url,
        String path,
        Map<String, String> headers,
        ObjectNode params,
        ObjectNode query,
        JsonNode body,
        Principal principal,
        Session session,
        RequestMetadata metadata
) {

    public ValidatedRequest withAuthentication(Principal principal, Session session) {
        return new ValidatedRequest(method, url, path, headers, params, query, body,
                principal, session, metadata);
    }

    public Optional<Principal> authenticatedPrincipal() {
        return Optional.ofNullable(principal);
    }

    public Optional<Session> activeSession() {
        return Optional.ofNullable(session);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /** Text value of a path parameter, or null when absent. */
    public String param(String name) {
        JsonNode value = params.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }
}
