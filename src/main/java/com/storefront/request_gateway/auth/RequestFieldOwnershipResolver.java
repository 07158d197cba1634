package com.storefront.request_gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the owner id from the request itself: path parameter {@code id}, then path
 * parameter {@code customerId}, then body field {@code customerId}.
 *
 * Admins own everything. A request with no owner id in any of those places is allowed.
 */
@Component
public class RequestFieldOwnershipResolver implements OwnershipResolver {

    static final String ADMIN_ROLE = "admin";

    @Override
    public boolean isOwner(Principal principal, ValidatedRequest request) {
        if (principal.hasRole(ADMIN_ROLE)) {
            return true;
        }
        String ownerId = ownerId(request);
        return ownerId == null || ownerId.equals(principal.id());
    }

    private static String ownerId(ValidatedRequest request) {
        String id = request.param("id");
        if (id != null) {
            return id;
        }
        String customerId = request.param("customerId");
        if (customerId != null) {
            return customerId;
        }
        JsonNode body = request.body();
        if (body != null && body.isObject()) {
            JsonNode fromBody = body.get("customerId");
            if (fromBody != null && !fromBody.isNull()) {
                return fromBody.asText();
            }
        }
        return null;
    }
}
