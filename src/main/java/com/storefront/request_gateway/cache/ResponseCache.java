package com.storefront.request_gateway.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.storefront.request_gateway.config.GatewayProperties;
import com.storefront.request_gateway.gateway.HandlerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BiPredicate;

/**
 * Handler responses kept for their endpoint's TTL, backed by a Caffeine cache.
 *
 * Each entry expires at its own {@code expiresAt}; Caffeine reads time from the
 * injected {@link Clock}, so expiry follows the same clock as the rest of the gateway.
 * Once {@code maxEntries} is reached Caffeine evicts by its size policy. Maintenance
 * runs on the calling thread and on the periodic purge.
 *
 * {@link #clear()} replaces the underlying cache, so counters start again from zero.
 */
@Component
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final int maxEntries;
    private final Clock clock;
    private volatile Cache<String, CacheEntry> cache;

    @Autowired
    public ResponseCache(GatewayProperties properties, Clock clock) {
        this(properties.getCache().getMaxEntries(), clock);
    }

    public ResponseCache(int maxEntries, Clock clock) {
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.cache = newCache();
    }

    private Cache<String, CacheEntry> newCache() {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .removalListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.SIZE) {
                        log.debug("Evicted cache entry {} over the {} entry bound", key, maxEntries);
                    }
                })
                .recordStats()
                .build();
    }

    /**
     * @return the live response stored under {@code key}, or empty on a miss or expiry
     */
    public Optional<HandlerResponse> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(CacheEntry::response);
    }

    public void put(String key, HandlerResponse response, Duration ttl, Collection<String> tags) {
        cache.put(key, new CacheEntry(response, clock.instant().plus(ttl), tags == null ? null : Set.copyOf(tags)));
    }

    /**
     * Removes every entry whose key contains {@code pattern}.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern) {
        return removeWhere((key, entry) -> key.contains(pattern));
    }

    public int invalidateTag(String tag) {
        return removeWhere((key, entry) -> entry.tags().contains(tag));
    }

    public void clear() {
        Cache<String, CacheEntry> previous = cache;
        cache = newCache();
        previous.invalidateAll();
    }

    public CacheStats stats() {
        Cache<String, CacheEntry> current = cache;
        current.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = current.stats();
        double hitRate = stats.requestCount() == 0 ? 0.0 : stats.hitRate();
        return new CacheStats((int) current.estimatedSize(), maxEntries,
                stats.hitCount(), stats.missCount(), stats.evictionCount(), hitRate);
    }

    @Scheduled(fixedDelayString = "${gateway.cache.purge-interval-ms:60000}")
    public void purgeExpired() {
        cache.cleanUp();
    }

    private int removeWhere(BiPredicate<String, CacheEntry> condition) {
        Cache<String, CacheEntry> current = cache;
        List<String> keys = current.asMap().entrySet().stream()
                .filter(entry -> condition.test(entry.getKey(), entry.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        current.invalidateAll(keys);
        log.debug("Invalidated {} cache entries", keys.size());
        return keys.size();
    }

    /** Expires each entry at its own {@code expiresAt}; reads do not extend it. */
    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return Math.max(0, TimeUnit.MILLISECONDS.toNanos(entry.expiresAt().toEpochMilli()) - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
