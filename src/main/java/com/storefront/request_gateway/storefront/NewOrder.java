package com.storefront.request_gateway.storefront;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.UUID;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Order placement request as accepted by {@code POST /api/orders}.
 */
public record NewOrder(
        @NotNull(message = "required")
        @UUID(message = "valid UUID")
        String customerId,

        @NotNull(message = "required")
        @Size(min = 1, message = "minimum {min} items")
        @Valid
        List<Item> items,

        @NotNull(message = "required")
        @Valid
        ShippingAddress shippingAddress,

        @NotNull(message = "required")
        @Size(min = 1, message = "minimum length {min}")
        String paymentMethodId,

        Map<String, Object> metadata
) {

    public record Item(
            @NotNull(message = "required")
            @UUID(message = "valid UUID")
            String productId,

            @NotNull(message = "required")
            @Positive(message = "positive")
            Integer quantity,

            @NotNull(message = "required")
            @Positive(message = "positive")
            BigDecimal price
    ) {}
}
