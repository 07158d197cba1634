package com.storefront.request_gateway.storefront;

import java.util.List;

public record ProductPage(List<Product> products, Pagination pagination) {

    public record Pagination(int page, int limit, long total, long pages) {}
}
