package com.storefront.request_gateway.ratelimit;

import com.storefront.request_gateway.auth.IdentityValidator;
import com.storefront.request_gateway.gateway.RawRequest;
import com.storefront.request_gateway.gateway.RequestContext;

/**
 * Decides which bucket a request is counted in. Requests with the same key share a
 * counter within one endpoint.
 *
 * Rate limiting runs before authentication, so resolvers see the raw request and the
 * request context but never an authenticated principal.
 */
@FunctionalInterface
public interface RateLimitKeyResolver {

    /** Bucket shared by every request whose client address is unknown. */
    String UNKNOWN_CLIENT = "unknown";

    String resolve(RawRequest request, RequestContext context);

    /** One bucket per client address. */
    static RateLimitKeyResolver clientAddress() {
        return (request, context) -> {
            String address = context.clientAddress();
            return address == null || address.isBlank() ? UNKNOWN_CLIENT : address;
        };
    }

    /**
     * One bucket per verified principal. Requests without a credential that verifies
     * share their client address bucket.
     */
    static RateLimitKeyResolver credential(IdentityValidator identityValidator) {
        return new CredentialKeyResolver(identityValidator, clientAddress());
    }
}
