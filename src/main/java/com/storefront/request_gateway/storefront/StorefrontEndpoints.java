package com.storefront.request_gateway.storefront;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.request_gateway.auth.AuthMethod;
import com.storefront.request_gateway.auth.AuthenticationConfig;
import com.storefront.request_gateway.auth.AuthorizationConfig;
import com.storefront.request_gateway.cache.CachingConfig;
import com.storefront.request_gateway.cache.VaryDimension;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.endpoint.EndpointRegistry;
import com.storefront.request_gateway.gateway.HandlerResponse;
import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import com.storefront.request_gateway.metrics.AlertThresholds;
import com.storefront.request_gateway.metrics.MonitoringConfig;
import com.storefront.request_gateway.ratelimit.RateLimitConfig;
import com.storefront.request_gateway.validation.ValidationConfig;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.List;
import java.util.Map;

/**
 * The storefront API served through the gateway.
 *
 * Registered once the bean is constructed, so the registry is populated before the
 * first request arrives:
 * <pre>
 *   GET  /api/products                 public, cached 5 min per query
 *   POST /api/orders                   authenticated, create:orders, owner only
 *   GET  /api/customers/:id            authenticated, owner only, cached 3 min
 *   POST /api/inventory/availability   public, cached 30 s per product/warehouse
 * </pre>
 */
@Component
public class StorefrontEndpoints {

    static final String CREATE_ORDERS = "create:orders";

    private final EndpointRegistry registry;
    private final StorefrontDataAccess dataAccess;
    private final ObjectMapper objectMapper;

    public StorefrontEndpoints(EndpointRegistry registry, StorefrontDataAccess dataAccess, ObjectMapper objectMapper) {
        this.registry = registry;
        this.dataAccess = dataAccess;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void registerEndpoints() {
        registry.register(products());
        registry.register(orders());
        registry.register(customer());
        registry.register(inventoryAvailability());
    }

    EndpointDefinition products() {
        return EndpointDefinition.builder()
                .method(RequestMethod.GET)
                .path("/api/products")
                .description("Paged product listing")
                .validation(ValidationConfig.query(ProductQuery.class))
                .rateLimit(RateLimitConfig.of(100, 60_000))
                .authentication(AuthenticationConfig.anonymousAllowing(AuthMethod.BEARER, AuthMethod.SESSION))
                .caching(CachingConfig.builder()
                        .enabled(true)
                        .ttlMs(300_000)
                        .varyBy(List.of(VaryDimension.QUERY))
                        .invalidationTags(List.of("products"))
                        .build())
                .monitoring(MonitoringConfig.withAlerts(new AlertThresholds(0.05, 1000L, 10.0)))
                .handler(this::listProducts)
                .build();
    }

    EndpointDefinition orders() {
        return EndpointDefinition.builder()
                .method(RequestMethod.POST)
                .path("/api/orders")
                .description("Place an order")
                .validation(ValidationConfig.body(NewOrder.class))
                .rateLimit(RateLimitConfig.of(10, 60_000))
                .authentication(AuthenticationConfig.requiring(AuthMethod.BEARER, AuthMethod.SESSION))
                .authorization(AuthorizationConfig.builder()
                        .required(true)
                        .permissions(List.of(CREATE_ORDERS))
                        .resourceOwnership(true)
                        .build())
                .monitoring(new MonitoringConfig(true, true, true, new AlertThresholds(0.02, 5000L, 1.0)))
                .handler(this::createOrder)
                .build();
    }

    EndpointDefinition customer() {
        return EndpointDefinition.builder()
                .method(RequestMethod.GET)
                .path("/api/customers/:id")
                .description("Customer profile with recent orders")
                .validation(ValidationConfig.params(CustomerLookup.class))
                .rateLimit(RateLimitConfig.of(50, 60_000))
                .authentication(AuthenticationConfig.requiring(AuthMethod.BEARER, AuthMethod.SESSION))
                .authorization(AuthorizationConfig.builder()
                        .required(true)
                        .resourceOwnership(true)
                        .build())
                .caching(CachingConfig.builder()
                        .enabled(true)
                        .ttlMs(180_000)
                        .keyFunction((request, context) -> "customer:" + request.param("id"))
                        .invalidationTags(List.of("customers"))
                        .build())
                .monitoring(MonitoringConfig.withAlerts(new AlertThresholds(0.03, 800L, 5.0)))
                .handler(this::getCustomer)
                .build();
    }

    EndpointDefinition inventoryAvailability() {
        return EndpointDefinition.builder()
                .method(RequestMethod.POST)
                .path("/api/inventory/availability")
                .description("Stock check across warehouses")
                .validation(ValidationConfig.body(AvailabilityCheck.class))
                .rateLimit(RateLimitConfig.of(200, 60_000))
                .authentication(AuthenticationConfig.anonymousAllowing(AuthMethod.BEARER, AuthMethod.SESSION))
                .caching(CachingConfig.builder()
                        .enabled(true)
                        .ttlMs(30_000)
                        .keyFunction(StorefrontEndpoints::inventoryKey)
                        .invalidationTags(List.of("inventory"))
                        .build())
                .monitoring(new MonitoringConfig(false, false, true, new AlertThresholds(0.01, 500L, 20.0)))
                .handler(this::checkAvailability)
                .build();
    }

    static String inventoryKey(ValidatedRequest request, RequestContext context) {
        JsonNode warehouse = request.body().get("warehouseId");
        return "inventory:" + request.body().get("productId").asText() + ":"
                + (warehouse == null || warehouse.isNull() ? "all" : warehouse.asText());
    }

    private HandlerResponse listProducts(ValidatedRequest request, RequestContext context) throws Exception {
        ProductQuery query = objectMapper.treeToValue(request.query(), ProductQuery.class);
        return HandlerResponse.ok(dataAccess.findProducts(query));
    }

    private HandlerResponse createOrder(ValidatedRequest request, RequestContext context) throws Exception {
        NewOrder newOrder = objectMapper.treeToValue(request.body(), NewOrder.class);
        Order order = dataAccess.createOrder(newOrder);
        return HandlerResponse.created(Map.of("order", order));
    }

    private HandlerResponse getCustomer(ValidatedRequest request, RequestContext context) {
        return dataAccess.findCustomer(request.param("id"))
                .map(customer -> HandlerResponse.ok(Map.of("customer", customer)))
                .orElseGet(() -> HandlerResponse.of(404, Map.of("error", "Customer not found")));
    }

    private HandlerResponse checkAvailability(ValidatedRequest request, RequestContext context) throws Exception {
        AvailabilityCheck check = objectMapper.treeToValue(request.body(), AvailabilityCheck.class);
        return HandlerResponse.ok(dataAccess.checkAvailability(check.productId(), check.quantity(), check.warehouseId()));
    }
}
