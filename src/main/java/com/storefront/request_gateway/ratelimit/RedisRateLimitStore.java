package com.storefront.request_gateway.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Counters shared by every gateway instance through Redis.
 *
 * Each counter is a plain Redis integer whose TTL is the window length. The
 * increment runs as one Lua script, so concurrent requests across instances cannot
 * interleave between the INCR and the expiry.
 *
 * Key format: {@code rl:{endpointKey}|{clientKey}}
 *
 * When Redis is unreachable the store fails open: the request is counted as the
 * first in a fresh window and a warning is logged.
 */
@Component
@ConditionalOnProperty(name = "gateway.rate-limit.store", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);

    static final String KEY_PREFIX = "rl:";

    /**
     * KEYS[1]  the counter key
     * ARGV[1]  window length in milliseconds
     *
     * Returns { count after increment, milliseconds left in the window }.
     */
    private static final String INCREMENT_SCRIPT = """
            local count = redis.call('INCR', KEYS[1])
            if count == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                -- key lost its expiry; start the window over
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return { count, ttl }
            """;

    private static final String RELEASE_SCRIPT = """
            local count = tonumber(redis.call('GET', KEYS[1]))
            if count ~= nil and count > 0 then
                return redis.call('DECR', KEYS[1])
            end
            return 0
            """;

    private static final RedisScript<List> INCREMENT = RedisScript.of(INCREMENT_SCRIPT, List.class);

    private static final RedisScript<Long> RELEASE = RedisScript.of(RELEASE_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public RateLimitCounter increment(String key, long windowMs, long nowMs) {
        try {
            List<?> result = redisTemplate.execute(INCREMENT, List.of(KEY_PREFIX + key), String.valueOf(windowMs));
            if (result == null || result.size() < 2) {
                log.warn("Rate limit script returned no result for key={}, failing open", key);
                return new RateLimitCounter(key, 1, nowMs, windowMs);
            }
            int count = ((Number) result.get(0)).intValue();
            long ttl = ((Number) result.get(1)).longValue();
            long windowStart = nowMs - (windowMs - ttl);
            return new RateLimitCounter(key, count, windowStart, windowMs);
        } catch (Exception e) {
            log.warn("Rate limiter Redis error for key={}: {}, failing open", key, e.getMessage());
            return new RateLimitCounter(key, 1, nowMs, windowMs);
        }
    }

    @Override
    public void release(String key, long nowMs) {
        try {
            redisTemplate.execute(RELEASE, List.of(KEY_PREFIX + key));
        } catch (Exception e) {
            log.warn("Rate limiter Redis release failed for key={}: {}", key, e.getMessage());
        }
    }

    @Override
    public void reset() {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
        log.info("Cleared {} Redis rate-limit counters", keys == null ? 0 : keys.size());
    }

    /** Redis expires counters on its own. */
    @Override
    public int purgeExpired(long nowMs) {
        return 0;
    }
}
