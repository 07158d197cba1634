package com.storefront.request_gateway.cache;

import lombok.Builder;

import java.util.List;

/**
 * Response caching for one endpoint.
 *
 * @param ttlMs            how long a stored response is served
 * @param varyBy           request parts folded into the generated key; ignored with a {@code keyFunction}
 * @param keyFunction      custom key, may be null
 * @param invalidationTags tags the stored entries carry, for bulk invalidation
 */
@Builder
public record CachingConfig(
        boolean enabled,
        long ttlMs,
        List<VaryDimension> varyBy,
        CacheKeyFunction keyFunction,
        List<String> invalidationTags
) {

    public CachingConfig {
        if (enabled && ttlMs <= 0) {
            throw new IllegalArgumentException("Cache TTL must be positive when caching is enabled");
        }
        varyBy = varyBy == null ? List.of() : List.copyOf(varyBy);
        invalidationTags = invalidationTags == null ? List.of() : List.copyOf(invalidationTags);
    }

    public static CachingConfig disabled() {
        return new CachingConfig(false, 0, null, null, null);
    }
}
