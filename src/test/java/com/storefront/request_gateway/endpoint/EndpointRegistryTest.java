package com.storefront.request_gateway.endpoint;

import com.storefront.request_gateway.gateway.HandlerResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EndpointRegistry")
class EndpointRegistryTest {

    private EndpointRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry();
    }

    private static EndpointDefinition endpoint(RequestMethod method, String path, String description) {
        return EndpointDefinition.builder()
                .method(method)
                .path(path)
                .description(description)
                .handler((request, context) -> HandlerResponse.ok(description))
                .build();
    }

    @Test
    @DisplayName("an exact registered path wins over a pattern registered earlier")
    void exactPathWinsOverPattern() {
        // given
        registry.register(endpoint(RequestMethod.GET, "/api/customers/:id", "pattern"));
        registry.register(endpoint(RequestMethod.GET, "/api/customers/me", "exact"));

        // when
        Optional<EndpointMatch> match = registry.resolve("GET", "/api/customers/me");

        // then
        assertThat(match).isPresent();
        assertThat(match.get().definition().description()).isEqualTo("exact");
        assertThat(match.get().pathParams()).isEmpty();
    }

    @Test
    @DisplayName("a pattern segment captures the request segment as a path parameter")
    void patternCapturesParameters() {
        registry.register(endpoint(RequestMethod.GET, "/api/customers/:customerId/orders/:orderId", "orders"));

        Optional<EndpointMatch> match = registry.resolve("get", "/api/customers/c-1/orders/o-9");

        assertThat(match).isPresent();
        assertThat(match.get().pathParams()).isEqualTo(Map.of("customerId", "c-1", "orderId", "o-9"));
    }

    @Test
    @DisplayName("parameters never span a slash and segment counts must match")
    void parametersDoNotSpanSegments() {
        registry.register(endpoint(RequestMethod.GET, "/api/customers/:id", "customer"));

        assertThat(registry.resolve("GET", "/api/customers/a/b")).isEmpty();
        assertThat(registry.resolve("GET", "/api/customers")).isEmpty();
        assertThat(registry.resolve("GET", "/api/customers/")).isEmpty();
    }

    @Test
    @DisplayName("resolution is scoped to the request method")
    void methodMustMatch() {
        registry.register(endpoint(RequestMethod.POST, "/api/orders", "create"));

        assertThat(registry.resolve("GET", "/api/orders")).isEmpty();
        assertThat(registry.resolve("POST", "/api/orders")).isPresent();
    }

    @Test
    @DisplayName("among patterns the first registered match wins")
    void firstRegisteredPatternWins() {
        registry.register(endpoint(RequestMethod.GET, "/api/:resource/:id", "generic"));
        registry.register(endpoint(RequestMethod.GET, "/api/products/:id", "products"));

        EndpointMatch match = registry.resolve("GET", "/api/products/42").orElseThrow();

        assertThat(match.definition().description()).isEqualTo("generic");
        assertThat(match.pathParams()).containsEntry("resource", "products").containsEntry("id", "42");
    }

    @Test
    @DisplayName("re-registering a key replaces the definition in place")
    void reRegisterReplaces() {
        registry.register(endpoint(RequestMethod.GET, "/api/a", "first"));
        registry.register(endpoint(RequestMethod.GET, "/api/b", "other"));
        registry.register(endpoint(RequestMethod.GET, "/api/a", "second"));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.definitions()).extracting(EndpointDefinition::description)
                .containsExactly("second", "other");
    }

    @Test
    @DisplayName("unregister removes the endpoint and reports whether it existed")
    void unregister() {
        registry.register(endpoint(RequestMethod.GET, "/api/a", "a"));

        assertThat(registry.unregister(RequestMethod.GET, "/api/a")).isTrue();
        assertThat(registry.unregister(RequestMethod.GET, "/api/a")).isFalse();
        assertThat(registry.resolve("GET", "/api/a")).isEmpty();
    }

    @Test
    @DisplayName("omitted stage configs default to stage off")
    void definitionDefaults() {
        EndpointDefinition definition = endpoint(RequestMethod.GET, "/api/a", "a");

        assertThat(definition.key()).isEqualTo("GET:/api/a");
        assertThat(definition.rateLimit()).isNull();
        assertThat(definition.caching().enabled()).isFalse();
        assertThat(definition.authentication().required()).isFalse();
        assertThat(definition.authorization().required()).isFalse();
        assertThat(definition.monitoring().trackMetrics()).isTrue();
    }
}
