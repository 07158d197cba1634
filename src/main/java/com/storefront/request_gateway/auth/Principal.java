package com.storefront.request_gateway.auth;

import java.util.List;
import java.util.Set;

/**
 * The identity a request runs as.
 *
 * @param id          stable identifier of the caller
 * @param email       may be null (API keys, anonymous callers)
 * @param roles       role names, checked any-of by the authorizer
 * @param permissions permission names, checked any-of by the authorizer
 */
public record Principal(String id, String email, Set<String> roles, Set<String> permissions) {

    public static final String ANONYMOUS_ID = "anonymous";

    public static final Principal ANONYMOUS =
            new Principal(ANONYMOUS_ID, null, Set.of(ANONYMOUS_ID), Set.of());

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean isAnonymous() {
        return this == ANONYMOUS || ANONYMOUS_ID.equals(id) && roles.contains(ANONYMOUS_ID);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    /** Sorted copy of the roles, used in error payloads. */
    public List<String> sortedRoles() {
        return roles.stream().sorted().toList();
    }

    /** Sorted copy of the permissions, used in error payloads. */
    public List<String> sortedPermissions() {
        return permissions.stream().sorted().toList();
    }
}
