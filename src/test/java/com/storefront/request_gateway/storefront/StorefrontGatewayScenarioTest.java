package com.storefront.request_gateway.storefront;

import com.storefront.request_gateway.auth.JwtTokenService;
import com.storefront.request_gateway.auth.Principal;
import com.storefront.request_gateway.cache.ResponseCache;
import com.storefront.request_gateway.ratelimit.RateLimiterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Set;

import static com.storefront.request_gateway.storefront.InMemoryStorefrontDataAccess.DEMO_CUSTOMER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end runs of the storefront endpoints through the servlet layer and the full pipeline.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Storefront through the gateway")
class StorefrontGatewayScenarioTest {

    private static final String LAMP = "4fad5e7c-9b5e-4e7a-9c8b-5a6b7c8d9ea5";
    private static final String OTHER_CUSTOMER = "9e8d7c6b-5a4f-4e3d-8c2b-1a0f9e8d7c6b";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenService tokenService;

    @Autowired
    private RateLimiterService rateLimiter;

    @Autowired
    private ResponseCache cache;

    @BeforeEach
    void resetState() {
        rateLimiter.reset();
        cache.clear();
    }

    private String bearer(String principalId, Set<String> permissions) {
        return "Bearer " + tokenService.issue(
                new Principal(principalId, "shopper@example.com", Set.of("customer"), permissions));
    }

    private static String orderBody(String customerId) {
        return """
                {
                  "customerId": "%s",
                  "items": [{"productId": "%s", "quantity": 1, "price": 58.75}],
                  "shippingAddress": {"line1": "1 Main St", "city": "Austin", "state": "TX", "postalCode": "78701"},
                  "paymentMethodId": "pm_card_visa"
                }
                """.formatted(customerId, LAMP);
    }

    @Test
    @DisplayName("GET /api/products is served from cache on the second call")
    void productsCached() throws Exception {
        MvcResult first = mockMvc.perform(get("/api/products").param("category", "home"))
                .andExpect(status().isOk())
                .andExpect(header().string("x-cached", "false"))
                .andExpect(header().string("x-ratelimit-limit", "100"))
                .andExpect(header().string("x-request-id", startsWith("req_")))
                .andExpect(jsonPath("$.products", hasSize(2)))
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.limit").value(20))
                .andReturn();

        MvcResult second = mockMvc.perform(get("/api/products").param("category", "home"))
                .andExpect(status().isOk())
                .andExpect(header().string("x-cached", "true"))
                .andReturn();

        assertThat(second.getResponse().getContentAsString()).isEqualTo(first.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("the 101st product listing in a minute is rejected")
    void productsRateLimited() throws Exception {
        for (int i = 0; i < 100; i++) {
            mockMvc.perform(get("/api/products")).andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/products"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("retry-after"))
                .andExpect(jsonPath("$.error.code").value("RATE_LIMIT_ERROR"))
                .andExpect(jsonPath("$.error.limit").value(100))
                .andExpect(jsonPath("$.error.retryAfter").isNumber());
    }

    @Test
    @DisplayName("invalid query values are rejected before anything else runs")
    void productsValidation() throws Exception {
        mockMvc.perform(get("/api/products").param("limit", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.field").value("query.limit"))
                .andExpect(jsonPath("$.error.constraint").value("maximum 100"));
    }

    @Test
    @DisplayName("POST /api/orders without credentials is a 401")
    void orderWithoutCredentials() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(orderBody(DEMO_CUSTOMER_ID)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("AUTHENTICATION_ERROR"))
                .andExpect(jsonPath("$.error.method").value("none"));
    }

    @Test
    @DisplayName("POST /api/orders without create:orders is a 403 naming the permission")
    void orderWithoutPermission() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", bearer(DEMO_CUSTOMER_ID, Set.of("read:orders")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(orderBody(DEMO_CUSTOMER_ID)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("AUTHORIZATION_ERROR"))
                .andExpect(jsonPath("$.error.required[0]").value("create:orders"));
    }

    @Test
    @DisplayName("customers cannot place orders for someone else")
    void orderForAnotherCustomer() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", bearer(OTHER_CUSTOMER, Set.of("create:orders")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(orderBody(DEMO_CUSTOMER_ID)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.required[0]").value("resource_owner"));
    }

    @Test
    @DisplayName("an authorized order is created with 201")
    void orderCreated() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", bearer(DEMO_CUSTOMER_ID, Set.of("create:orders")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(orderBody(DEMO_CUSTOMER_ID)))
                .andExpect(status().isCreated())
                .andExpect(header().string("x-cached", "false"))
                .andExpect(jsonPath("$.order.customerId").value(DEMO_CUSTOMER_ID))
                .andExpect(jsonPath("$.order.status").value("pending"))
                .andExpect(jsonPath("$.order.shippingAddress.country").value("US"))
                .andExpect(jsonPath("$.order.total").value(58.75));
    }

    @Test
    @DisplayName("a zero quantity fails validation with the item path")
    void orderValidation() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", bearer(DEMO_CUSTOMER_ID, Set.of("create:orders")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(orderBody(DEMO_CUSTOMER_ID).replace("\"quantity\": 1", "\"quantity\": 0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.field").value("body.items[0].quantity"))
                .andExpect(jsonPath("$.error.constraint").value("positive"));
    }

    @Test
    @DisplayName("GET /api/customers/:id is owner-only and rejects malformed ids")
    void customerProfile() throws Exception {
        mockMvc.perform(get("/api/customers/" + DEMO_CUSTOMER_ID)
                        .header("Authorization", bearer(DEMO_CUSTOMER_ID, Set.of())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customer.id").value(DEMO_CUSTOMER_ID));

        mockMvc.perform(get("/api/customers/" + DEMO_CUSTOMER_ID)
                        .header("Authorization", bearer(OTHER_CUSTOMER, Set.of())))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/customers/not-a-uuid")
                        .header("Authorization", bearer(DEMO_CUSTOMER_ID, Set.of())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.field").value("params.id"));
    }

    @Test
    @DisplayName("POST /api/inventory/availability works anonymously and caches per product")
    void inventoryAvailability() throws Exception {
        String body = "{\"productId\":\"" + LAMP + "\",\"quantity\":5}";

        mockMvc.perform(post("/api/inventory/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.warehouses", hasSize(2)));

        mockMvc.perform(post("/api/inventory/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(header().string("x-cached", "true"));
    }

    @Test
    @DisplayName("unregistered paths are a 404 in the error envelope")
    void unknownPath() throws Exception {
        mockMvc.perform(get("/api/wishlists"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.requestId", startsWith("req_")));
    }

    @Test
    @DisplayName("the admin API lists the storefront endpoints")
    void adminListsEndpoints() throws Exception {
        mockMvc.perform(get("/gateway/admin/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints", hasSize(4)))
                .andExpect(jsonPath("$.endpoints[0].key").value("GET:/api/products"));
    }
}
