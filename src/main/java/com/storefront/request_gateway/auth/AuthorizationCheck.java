package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;

/**
 * Endpoint-specific authorization rule, evaluated after roles, permissions and ownership.
 */
@FunctionalInterface
public interface AuthorizationCheck {

    boolean isAllowed(Principal principal, ValidatedRequest request, RequestContext context);
}
