package com.storefront.request_gateway.storefront;

import java.util.Optional;

/**
 * Data-access collaborator behind the storefront endpoint handlers. The gateway itself
 * never calls it.
 */
public interface StorefrontDataAccess {

    ProductPage findProducts(ProductQuery query);

    Optional<Customer> findCustomer(String customerId);

    Order createOrder(NewOrder order);

    /**
     * @param warehouseId restrict to one warehouse, or null for all
     */
    InventoryAvailability checkAvailability(String productId, int quantity, String warehouseId);
}
