package com.storefront.request_gateway.auth;

/**
 * Result of a successful credential check.
 *
 * @param principal resolved identity
 * @param session   only set for session authentication
 * @param method    the credential method that produced the principal; null for anonymous
 */
public record Authentication(Principal principal, Session session, AuthMethod method) {

    public static Authentication anonymous() {
        return new Authentication(Principal.ANONYMOUS, null, null);
    }

    public static Authentication of(Principal principal, AuthMethod method) {
        return new Authentication(principal, null, method);
    }
}
