package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.ValidatedRequest;

/**
 * Decides whether a principal owns the resource a request targets.
 */
public interface OwnershipResolver {

    boolean isOwner(Principal principal, ValidatedRequest request);
}
