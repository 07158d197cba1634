package com.storefront.request_gateway.storefront;

import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.UUID;

/** Path parameters of {@code GET /api/customers/:id}. */
public record CustomerLookup(
        @NotNull(message = "required")
        @UUID(message = "valid UUID")
        String id
) {}
