package com.storefront.request_gateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storefront.request_gateway.auth.Principal;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Builds cache keys.
 *
 * Generated keys look like {@code GET:/api/products|query={"category":"books","page":1}}.
 * Object keys are sorted at every level, so two requests that differ only in
 * parameter order share an entry.
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String generate(EndpointDefinition endpoint, ValidatedRequest request, RequestContext context) {
        CachingConfig caching = endpoint.caching();
        if (caching.keyFunction() != null) {
            return caching.keyFunction().key(request, context);
        }

        StringBuilder key = new StringBuilder(endpoint.key());
        for (VaryDimension dimension : caching.varyBy()) {
            key.append('|').append(dimension.name().toLowerCase(Locale.ROOT)).append('=');
            switch (dimension) {
                case QUERY -> key.append(canonicalJson(request.query()));
                case PARAMS -> key.append(canonicalJson(request.params()));
                case PRINCIPAL -> key.append(request.authenticatedPrincipal()
                        .map(Principal::id)
                        .orElse(Principal.ANONYMOUS_ID));
            }
        }
        return key.toString();
    }

    private String canonicalJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(sorted(node == null ? NullNode.getInstance() : node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache key component", e);
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> iterator = node.fieldNames();
            iterator.forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                result.set(name, sorted(node.get(name)));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            node.forEach(element -> result.add(sorted(element)));
            return result;
        }
        return node;
    }
}
