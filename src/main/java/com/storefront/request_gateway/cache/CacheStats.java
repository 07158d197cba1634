package com.storefront.request_gateway.cache;

/**
 * Point-in-time cache counters. {@code evictions} counts entries dropped by the size
 * bound or by expiry. {@code hitRate} is hits over lookups, 0 before the first lookup.
 */
public record CacheStats(int size, int maxEntries, long hits, long misses, long evictions, double hitRate) {}
