package com.storefront.request_gateway.storefront;

import java.time.Instant;
import java.util.List;

/**
 * A customer with their most recent orders, newest first.
 */
public record Customer(String id, String email, String firstName, String lastName, Instant createdAt,
                       List<Order> recentOrders) {}
