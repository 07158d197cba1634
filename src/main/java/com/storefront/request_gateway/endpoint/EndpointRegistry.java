package com.storefront.request_gateway.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Table of every endpoint the gateway serves, keyed by {@code METHOD:path}.
 *
 * Resolution tries the exact key first, so a literal path always wins over a
 * pattern that would also match it. Otherwise the definitions for the request
 * method are scanned in registration order and the first pattern match wins.
 *
 * Thread safety: reads are lock-free against a volatile, never-mutated map. Writers
 * build a new map and swap the reference, so a resolve in flight keeps seeing the
 * table it started with.
 */
@Component
public class EndpointRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    private volatile Map<String, EndpointDefinition> endpoints = Map.of();

    /**
     * Adds the definition, or replaces the one already registered under the same key.
     * A replaced definition keeps its original position in the scan order.
     */
    public synchronized void register(EndpointDefinition definition) {
        Map<String, EndpointDefinition> updated = new LinkedHashMap<>(endpoints);
        EndpointDefinition previous = updated.put(definition.key(), definition);
        this.endpoints = Collections.unmodifiableMap(updated);
        if (previous == null) {
            log.info("Registered endpoint {}", definition.key());
        } else {
            log.info("Replaced endpoint {}", definition.key());
        }
    }

    public synchronized boolean unregister(RequestMethod method, String path) {
        String key = EndpointDefinition.key(method, path);
        if (!endpoints.containsKey(key)) {
            return false;
        }
        Map<String, EndpointDefinition> updated = new LinkedHashMap<>(endpoints);
        updated.remove(key);
        this.endpoints = Collections.unmodifiableMap(updated);
        log.info("Unregistered endpoint {}", key);
        return true;
    }

    public synchronized void clear() {
        this.endpoints = Map.of();
    }

    /** Snapshot of the registered definitions in registration order. */
    public List<EndpointDefinition> definitions() {
        return List.copyOf(endpoints.values());
    }

    /**
     * Finds the endpoint for an inbound method and path.
     *
     * @param method HTTP method name, case-insensitive
     * @param path   request path without the query string
     * @return the match with captured parameters, or empty if nothing is registered for it
     */
    public Optional<EndpointMatch> resolve(String method, String path) {
        String normalizedMethod = method.toUpperCase(Locale.ROOT);
        Map<String, EndpointDefinition> snapshot = this.endpoints;

        EndpointDefinition exact = snapshot.get(normalizedMethod + ":" + path);
        if (exact != null) {
            return Optional.of(new EndpointMatch(exact, Map.of()));
        }

        String[] requestSegments = path.split("/", -1);
        for (EndpointDefinition definition : snapshot.values()) {
            if (!definition.method().name().equals(normalizedMethod)) {
                continue;
            }
            Map<String, String> params = match(definition.path().split("/", -1), requestSegments);
            if (params != null) {
                return Optional.of(new EndpointMatch(definition, params));
            }
        }
        return Optional.empty();
    }

    /**
     * Segment-by-segment comparison. Returns the captured parameters, or null on mismatch.
     */
    private static Map<String, String> match(String[] pattern, String[] request) {
        if (pattern.length != request.length) {
            return null;
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < pattern.length; i++) {
            String expected = pattern[i];
            String actual = request[i];
            if (expected.startsWith(":") && expected.length() > 1) {
                if (actual.isEmpty()) {
                    return null;
                }
                params.put(expected.substring(1), actual);
            } else if (!expected.equals(actual)) {
                return null;
            }
        }
        return params;
    }

    /** Number of registered endpoints. */
    public int size() {
        return endpoints.size();
    }
}
