package com.storefront.request_gateway.auth;

import lombok.Builder;

import java.util.List;

/**
 * Access rules for an endpoint. Roles and permissions are any-of lists; an empty list
 * skips that check.
 */
@Builder
public record AuthorizationConfig(
        boolean required,
        List<String> roles,
        List<String> permissions,
        boolean resourceOwnership,
        AuthorizationCheck customCheck
) {

    public AuthorizationConfig {
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static AuthorizationConfig none() {
        return new AuthorizationConfig(false, null, null, false, null);
    }
}
