package com.storefront.request_gateway.storefront;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.UUID;

/**
 * Body of {@code POST /api/inventory/availability}. A null {@code warehouseId} checks
 * every warehouse.
 */
public record AvailabilityCheck(
        @NotNull(message = "required")
        @UUID(message = "valid UUID")
        String productId,

        @NotNull(message = "required")
        @Positive(message = "positive")
        Integer quantity,

        @Size(min = 1, message = "minimum length {min}")
        String warehouseId
) {}
