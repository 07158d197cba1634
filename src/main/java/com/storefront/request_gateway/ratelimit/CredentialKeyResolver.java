package com.storefront.request_gateway.ratelimit;

import com.storefront.request_gateway.auth.Authentication;
import com.storefront.request_gateway.auth.IdentityValidator;
import com.storefront.request_gateway.auth.Principal;
import com.storefront.request_gateway.gateway.RawRequest;
import com.storefront.request_gateway.gateway.RequestContext;

import java.util.Optional;

/**
 * Keys requests by the principal behind the credential they carry (bearer token,
 * session id or API key, in that order). Only credentials the {@link IdentityValidator}
 * accepts count; a request with no credential, or one that does not verify, is keyed
 * by the fallback resolver.
 */
class CredentialKeyResolver implements RateLimitKeyResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityValidator identityValidator;
    private final RateLimitKeyResolver fallback;

    CredentialKeyResolver(IdentityValidator identityValidator, RateLimitKeyResolver fallback) {
        this.identityValidator = identityValidator;
        this.fallback = fallback;
    }

    @Override
    public String resolve(RawRequest request, RequestContext context) {
        return verifiedPrincipal(request)
                .map(principal -> "principal:" + principal.id())
                .orElseGet(() -> fallback.resolve(request, context));
    }

    private Optional<Principal> verifiedPrincipal(RawRequest request) {
        String authorization = request.header("authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            Optional<Principal> principal = identityValidator.validateToken(
                    authorization.substring(BEARER_PREFIX.length()).trim());
            if (principal.isPresent()) {
                return principal;
            }
        }
        String sessionId = request.header("x-session-id");
        if (sessionId != null && !sessionId.isBlank()) {
            Optional<Principal> principal = identityValidator.validateSession(sessionId)
                    .map(Authentication::principal);
            if (principal.isPresent()) {
                return principal;
            }
        }
        String apiKey = request.header("x-api-key");
        if (apiKey != null && !apiKey.isBlank()) {
            return identityValidator.validateApiKey(apiKey);
        }
        return Optional.empty();
    }
}
