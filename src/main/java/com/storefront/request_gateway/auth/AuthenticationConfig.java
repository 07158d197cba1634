package com.storefront.request_gateway.auth;

import java.util.List;

/**
 * Which credentials an endpoint accepts and whether it needs one at all.
 *
 * @param required        reject callers without a valid credential unless {@code allowAnonymous}
 * @param methods         credential methods, tried in this order
 * @param allowAnonymous  let callers without a credential through as {@link Principal#ANONYMOUS}
 * @param sessionRequired only a session credential satisfies the endpoint
 */
public record AuthenticationConfig(
        boolean required,
        List<AuthMethod> methods,
        boolean allowAnonymous,
        boolean sessionRequired
) {

    public AuthenticationConfig {
        methods = methods == null || methods.isEmpty() ? List.of(AuthMethod.values()) : List.copyOf(methods);
    }

    /** No credential needed; one is still resolved when presented. */
    public static AuthenticationConfig none() {
        return new AuthenticationConfig(false, null, true, false);
    }

    public static AuthenticationConfig requiring(AuthMethod... methods) {
        return new AuthenticationConfig(true, List.of(methods), false, false);
    }

    public static AuthenticationConfig anonymousAllowing(AuthMethod... methods) {
        return new AuthenticationConfig(false, List.of(methods), true, false);
    }

    public static AuthenticationConfig sessionOnly() {
        return new AuthenticationConfig(true, List.of(AuthMethod.SESSION), false, true);
    }

    public boolean anonymousPermitted() {
        return !required || allowAnonymous;
    }
}
