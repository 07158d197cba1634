package com.storefront.request_gateway.auth;

import java.util.Optional;

/**
 * Turns raw credentials into identities. Each method returns empty for an unknown,
 * expired or tampered credential; it never throws for a bad credential.
 */
public interface IdentityValidator {

    Optional<Principal> validateToken(String token);

    Optional<Authentication> validateSession(String sessionId);

    Optional<Principal> validateApiKey(String apiKey);
}
