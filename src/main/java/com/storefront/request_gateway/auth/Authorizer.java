package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.error.AuthorizationException;
import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies an endpoint's {@link AuthorizationConfig} to the authenticated principal.
 *
 * Checks run in order (roles, permissions, ownership, custom rule) and the first that
 * fails is reported with what it required and what the principal had.
 */
@Component
public class Authorizer {

    private static final Logger log = LoggerFactory.getLogger(Authorizer.class);

    static final String RESOURCE_OWNER = "resource_owner";
    static final String CUSTOM = "custom";

    private final OwnershipResolver ownershipResolver;

    public Authorizer(OwnershipResolver ownershipResolver) {
        this.ownershipResolver = ownershipResolver;
    }

    public void authorize(EndpointDefinition endpoint, ValidatedRequest request, RequestContext context) {
        AuthorizationConfig config = endpoint.authorization();
        if (!config.required()) {
            return;
        }

        Principal principal = request.principal();
        if (principal == null) {
            throw deny(endpoint, "No authenticated principal", List.of("authenticated"), List.of());
        }

        if (!config.roles().isEmpty() && config.roles().stream().noneMatch(principal::hasRole)) {
            throw deny(endpoint, "Insufficient role", config.roles(), principal.sortedRoles());
        }

        if (!config.permissions().isEmpty() && config.permissions().stream().noneMatch(principal::hasPermission)) {
            throw deny(endpoint, "Insufficient permissions", config.permissions(), principal.sortedPermissions());
        }

        if (config.resourceOwnership() && !ownershipResolver.isOwner(principal, request)) {
            throw deny(endpoint, "Access is restricted to the resource owner",
                    List.of(RESOURCE_OWNER), principal.sortedRoles());
        }

        if (config.customCheck() != null && !config.customCheck().isAllowed(principal, request, context)) {
            throw deny(endpoint, "Access denied by endpoint rule", List.of(CUSTOM), List.of());
        }
    }

    private static AuthorizationException deny(EndpointDefinition endpoint, String message,
                                               List<String> required, List<String> actual) {
        log.warn("Authorization failed for {}: {} required={} actual={}", endpoint.key(), message, required, actual);
        return new AuthorizationException(message, required, actual);
    }
}
