package com.storefront.request_gateway.storefront;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record Order(
        String id,
        String orderNumber,
        String customerId,
        String status,
        List<Line> items,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal shipping,
        BigDecimal total,
        ShippingAddress shippingAddress,
        Instant createdAt
) {

    public record Line(String productId, int quantity, BigDecimal unitPrice, BigDecimal totalPrice) {}
}
