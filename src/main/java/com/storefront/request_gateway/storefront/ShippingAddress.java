package com.storefront.request_gateway.storefront;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Delivery address. {@code country} defaults to {@code US}.
 */
public record ShippingAddress(
        @NotNull(message = "required")
        @Size(min = 1, message = "minimum length {min}")
        String line1,

        String line2,

        @NotNull(message = "required")
        @Size(min = 1, message = "minimum length {min}")
        String city,

        @NotNull(message = "required")
        @Size(min = 2, max = 2, message = "exactly 2 characters")
        String state,

        @NotNull(message = "required")
        @Size(min = 5, message = "minimum length {min}")
        String postalCode,

        @Size(min = 2, message = "minimum length {min}")
        String country
) {

    public ShippingAddress {
        country = country == null ? "US" : country;
    }
}
