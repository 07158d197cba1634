package com.storefront.request_gateway.storefront;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Stock for one product across warehouses. {@code alternatives} lists products in the
 * same category that can cover the quantity when this one cannot.
 */
public record InventoryAvailability(
        String productId,
        int requested,
        boolean available,
        int totalAvailable,
        List<WarehouseStock> warehouses,
        List<String> alternatives
) {

    public record WarehouseStock(String warehouseId, int available, int reserved, Instant estimatedDelivery,
                                 BigDecimal shippingCost) {}
}
