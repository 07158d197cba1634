package com.storefront.request_gateway.cache;

import com.storefront.request_gateway.gateway.HandlerResponse;

import java.time.Instant;
import java.util.Set;

public record CacheEntry(HandlerResponse response, Instant expiresAt, Set<String> tags) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
