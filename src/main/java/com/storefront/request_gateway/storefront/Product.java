package com.storefront.request_gateway.storefront;

import java.math.BigDecimal;
import java.time.Instant;

public record Product(String id, String name, String category, BigDecimal price, int stock, Instant createdAt) {}
