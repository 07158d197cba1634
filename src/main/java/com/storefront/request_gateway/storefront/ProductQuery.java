package com.storefront.request_gateway.storefront;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Filters and paging for a product listing, bound from the query string. {@code page}
 * defaults to 1 and {@code limit} to 20; the remaining fields may be null.
 */
public record ProductQuery(
        @Min(value = 1, message = "minimum {value}")
        Integer page,

        @Min(value = 1, message = "minimum {value}")
        @Max(value = 100, message = "maximum {value}")
        Integer limit,

        @Size(max = 50, message = "maximum length {max}")
        String category,

        @Size(max = 100, message = "maximum length {max}")
        String search,

        @Pattern(regexp = "name|price|created", message = "one of name, price, created")
        String sortBy,

        @Pattern(regexp = "asc|desc", message = "one of asc, desc")
        String sortOrder
) {

    public ProductQuery {
        page = page == null ? 1 : page;
        limit = limit == null ? 20 : limit;
    }
}
