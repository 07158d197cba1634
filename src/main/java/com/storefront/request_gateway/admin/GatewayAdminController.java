package com.storefront.request_gateway.admin;

import com.storefront.request_gateway.accesslog.ErrorEvent;
import com.storefront.request_gateway.cache.CacheStats;
import com.storefront.request_gateway.cache.ResponseCache;
import com.storefront.request_gateway.config.GatewayProperties;
import com.storefront.request_gateway.endpoint.EndpointRegistry;
import com.storefront.request_gateway.metrics.ErrorLog;
import com.storefront.request_gateway.metrics.MetricsCollector;
import com.storefront.request_gateway.metrics.MetricsSnapshot;
import com.storefront.request_gateway.ratelimit.RateLimiterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational API for the gateway.
 *
 * All endpoints live under /gateway/admin. This controller is matched by Spring MVC
 * directly and does not pass through the gateway pipeline.
 */
@RestController
@RequestMapping("/gateway/admin")
public class GatewayAdminController {

    static final int MAX_ERROR_LIMIT = 1000;

    private final EndpointRegistry registry;
    private final MetricsCollector metrics;
    private final ErrorLog errorLog;
    private final ResponseCache cache;
    private final RateLimiterService rateLimiter;
    private final GatewayProperties properties;

    public GatewayAdminController(EndpointRegistry registry, MetricsCollector metrics, ErrorLog errorLog,
                                  ResponseCache cache, RateLimiterService rateLimiter,
                                  GatewayProperties properties) {
        this.registry = registry;
        this.metrics = metrics;
        this.errorLog = errorLog;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    /**
     * GET /gateway/admin/endpoints
     * Registered endpoints in resolution order, with the gateway version.
     */
    @GetMapping("/endpoints")
    public Map<String, Object> endpoints() {
        List<EndpointSummary> endpoints = registry.definitions().stream()
                .map(EndpointSummary::from)
                .toList();
        return Map.of("version", properties.getVersion(), "endpoints", endpoints);
    }

    /**
     * GET /gateway/admin/metrics
     */
    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * POST /gateway/admin/metrics/reset
     * Starts a new measurement period. Returns 204 No Content.
     */
    @PostMapping("/metrics/reset")
    public ResponseEntity<Void> resetMetrics() {
        metrics.reset();
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /gateway/admin/errors?limit=20
     * Most recent error events, newest first.
     */
    @GetMapping("/errors")
    public List<ErrorEvent> errors(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_ERROR_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_ERROR_LIMIT);
        }
        return errorLog.recent(limit);
    }

    /**
     * GET /gateway/admin/cache/stats
     */
    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * DELETE /gateway/admin/cache?pattern=products
     * Without a pattern the whole cache is cleared.
     */
    @DeleteMapping("/cache")
    public Map<String, Object> invalidateCache(@RequestParam(required = false) String pattern) {
        if (pattern == null) {
            cache.clear();
            return Map.of("cleared", true);
        }
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        return Map.of("pattern", pattern, "invalidated", cache.invalidate(pattern));
    }

    /**
     * DELETE /gateway/admin/cache/tags/{tag}
     */
    @DeleteMapping("/cache/tags/{tag}")
    public Map<String, Object> invalidateTag(@PathVariable String tag) {
        return Map.of("tag", tag, "invalidated", cache.invalidateTag(tag));
    }

    /**
     * DELETE /gateway/admin/rate-limits
     * Drops every rate-limit counter. Returns 204 No Content.
     */
    @DeleteMapping("/rate-limits")
    public ResponseEntity<Void> resetRateLimits() {
        rateLimiter.reset();
        return ResponseEntity.noContent().build();
    }
}
