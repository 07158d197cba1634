package com.storefront.request_gateway.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.request_gateway.accesslog.AccessLogEvent;
import com.storefront.request_gateway.accesslog.ErrorEvent;
import com.storefront.request_gateway.accesslog.MonitoringDispatcher;
import com.storefront.request_gateway.auth.Authentication;
import com.storefront.request_gateway.auth.Authenticator;
import com.storefront.request_gateway.auth.Authorizer;
import com.storefront.request_gateway.auth.Principal;
import com.storefront.request_gateway.cache.CacheKeyGenerator;
import com.storefront.request_gateway.cache.CachingConfig;
import com.storefront.request_gateway.cache.ResponseCache;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.endpoint.EndpointMatch;
import com.storefront.request_gateway.endpoint.EndpointRegistry;
import com.storefront.request_gateway.error.EndpointNotFoundException;
import com.storefront.request_gateway.error.ErrorCode;
import com.storefront.request_gateway.error.ErrorEnvelope;
import com.storefront.request_gateway.error.GatewayErrorMapper;
import com.storefront.request_gateway.error.GatewayException;
import com.storefront.request_gateway.error.HandlerTimeoutException;
import com.storefront.request_gateway.error.InternalGatewayException;
import com.storefront.request_gateway.error.RateLimitException;
import com.storefront.request_gateway.metrics.ErrorLog;
import com.storefront.request_gateway.metrics.MetricsCollector;
import com.storefront.request_gateway.ratelimit.RateLimiterService;
import com.storefront.request_gateway.ratelimit.RateLimiterService.RateLimitDecision;
import com.storefront.request_gateway.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point of the gateway: takes a raw request through the fixed pipeline
 * and always returns a response, never an exception.
 *
 * Pipeline (fail-fast, in this order):
 * <pre>
 *   resolve -> validate -> rate limit -> authenticate -> authorize
 *           -> cache lookup (a hit skips the handler) -> handler -> cache store
 *           -> metrics / monitoring -> response assembly
 * </pre>
 *
 * The first stage that throws decides the response: its {@link GatewayException} is
 * mapped to an {@link ErrorEnvelope} and no later stage runs. Metrics, the error log
 * and the monitoring sinks see every request, including rejected ones.
 */
@Service
public class GatewayOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GatewayOrchestrator.class);

    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String PROCESSING_TIME_HEADER = "x-processing-time";
    public static final String CACHED_HEADER = "x-cached";
    public static final String RETRY_AFTER_HEADER = "retry-after";
    public static final String RATE_LIMIT_LIMIT_HEADER = "x-ratelimit-limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "x-ratelimit-remaining";

    private final EndpointRegistry registry;
    private final RequestContextFactory contextFactory;
    private final RequestValidator validator;
    private final RateLimiterService rateLimiter;
    private final Authenticator authenticator;
    private final Authorizer authorizer;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final ResponseCache cache;
    private final HandlerInvoker handlerInvoker;
    private final MetricsCollector metrics;
    private final ErrorLog errorLog;
    private final MonitoringDispatcher monitoring;
    private final GatewayErrorMapper errorMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GatewayOrchestrator(EndpointRegistry registry,
                               RequestContextFactory contextFactory,
                               RequestValidator validator,
                               RateLimiterService rateLimiter,
                               Authenticator authenticator,
                               Authorizer authorizer,
                               CacheKeyGenerator cacheKeyGenerator,
                               ResponseCache cache,
                               HandlerInvoker handlerInvoker,
                               MetricsCollector metrics,
                               ErrorLog errorLog,
                               MonitoringDispatcher monitoring,
                               GatewayErrorMapper errorMapper,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.registry = registry;
        this.contextFactory = contextFactory;
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
        this.authorizer = authorizer;
        this.cacheKeyGenerator = cacheKeyGenerator;
        this.cache = cache;
        this.handlerInvoker = handlerInvoker;
        this.metrics = metrics;
        this.errorLog = errorLog;
        this.monitoring = monitoring;
        this.errorMapper = errorMapper;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /** Mutable per-call state shared by the pipeline and the completion step. */
    private static final class Exchange {
        final RawRequest raw;
        final RequestContext context;
        final long startMs;
        EndpointDefinition endpoint;
        RateLimitDecision rateLimit = RateLimitDecision.unlimited();
        Principal principal;

        Exchange(RawRequest raw, RequestContext context, long startMs) {
            this.raw = raw;
            this.context = context;
            this.startMs = startMs;
        }
    }

    public GatewayResponse handleRequest(RawRequest raw) {
        Exchange exchange = new Exchange(raw, contextFactory.create(raw), clock.millis());
        try {
            return process(exchange);
        } catch (RuntimeException e) {
            return fail(exchange, e);
        }
    }

    private GatewayResponse process(Exchange exchange) {
        RawRequest raw = exchange.raw;
        RequestContext context = exchange.context;

        // --- Step 1: Resolve ---
        EndpointMatch match = registry.resolve(raw.method(), raw.path())
                .orElseThrow(() -> new EndpointNotFoundException(raw.method(), raw.path()));
        EndpointDefinition endpoint = match.definition();
        exchange.endpoint = endpoint;

        // --- Step 2: Validate ---
        ValidatedRequest request = validator.validate(raw, match,
                new RequestMetadata(context.requestId(), context.timestamp()));

        // --- Step 3: Rate limit ---
        exchange.rateLimit = rateLimiter.check(endpoint, raw, context);

        // --- Step 4: Authenticate ---
        Authentication authentication = authenticator.authenticate(endpoint, request);
        request = request.withAuthentication(authentication.principal(), authentication.session());
        exchange.principal = authentication.principal();

        // --- Step 5: Authorize ---
        authorizer.authorize(endpoint, request, context);

        // --- Step 6: Cache lookup ---
        CachingConfig caching = endpoint.caching();
        String cacheKey = null;
        if (caching.enabled()) {
            cacheKey = cacheKeyGenerator.generate(endpoint, request, context);
            Optional<HandlerResponse> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Cache hit {} for {}", cacheKey, endpoint.key());
                HandlerResponse hit = cached.get();
                return complete(exchange, hit.status(), hit.headers(), hit.body(), true, null);
            }
        }

        // --- Step 7: Invoke handler ---
        HandlerResponse response = handlerInvoker.invoke(endpoint, request, context);

        // --- Step 8: Cache store ---
        if (cacheKey != null && !response.isError()) {
            cache.put(cacheKey, response, Duration.ofMillis(caching.ttlMs()), caching.invalidationTags());
        }

        return complete(exchange, response.status(), response.headers(), response.body(), false, null);
    }

    private GatewayResponse fail(Exchange exchange, RuntimeException thrown) {
        GatewayException error = errorMapper.classify(thrown);
        String requestId = exchange.context.requestId();

        if (error instanceof InternalGatewayException) {
            log.error("Internal error on {} {} requestId={}",
                    exchange.raw.method(), exchange.raw.path(), requestId, error.getCause());
        } else if (error instanceof HandlerTimeoutException) {
            log.warn("Timed out {} {} requestId={}", exchange.raw.method(), exchange.raw.path(), requestId);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (error instanceof RateLimitException rateLimitError) {
            metrics.recordRateLimitHit();
            headers.put(RETRY_AFTER_HEADER, String.valueOf(rateLimitError.getRetryAfterSeconds()));
            headers.put(RATE_LIMIT_LIMIT_HEADER, String.valueOf(rateLimitError.getLimit()));
            headers.put(RATE_LIMIT_REMAINING_HEADER, "0");
        }

        ErrorEnvelope envelope = errorMapper.toEnvelope(error, requestId);
        int status = error.getErrorCode().getStatus().value();

        ErrorEvent event = new ErrorEvent(
                clock.instant(),
                requestId,
                exchange.raw.method(),
                exchange.raw.path(),
                exchange.endpoint == null ? null : exchange.endpoint.key(),
                envelope.code(),
                status,
                envelope.message(),
                exchange.context.clientAddress());
        errorLog.append(event);
        monitoring.error(event);

        return complete(exchange, status, headers, envelope, false, envelope.code());
    }

    /**
     * Records the outcome and assembles the final response. Runs exactly once per request.
     */
    private GatewayResponse complete(Exchange exchange, int status, Map<String, String> handlerHeaders,
                                     Object body, boolean cached, String errorCode) {
        long processingTimeMs = Math.max(0, clock.millis() - exchange.startMs);
        EndpointDefinition endpoint = exchange.endpoint;
        String requestId = exchange.context.requestId();

        if (exchange.rateLimit.isLimited()) {
            rateLimiter.complete(exchange.rateLimit, status);
        }

        boolean trackEndpoint = endpoint != null && endpoint.monitoring().trackMetrics();
        metrics.record(trackEndpoint ? endpoint.key() : null, status, processingTimeMs);

        if (endpoint == null || endpoint.monitoring().logRequests()) {
            monitoring.accessLog(new AccessLogEvent(
                    exchange.context.timestamp(),
                    requestId,
                    exchange.context.correlation().traceId(),
                    exchange.context.clientAddress(),
                    exchange.raw.method(),
                    exchange.raw.path(),
                    endpoint == null ? null : endpoint.key(),
                    exchange.principal == null ? null : exchange.principal.id(),
                    status,
                    processingTimeMs,
                    cached,
                    ErrorCode.RATE_LIMIT_ERROR.name().equals(errorCode),
                    errorCode));
        }
        if (endpoint != null && endpoint.monitoring().logResponses()) {
            logResponseSize(endpoint, status, body, requestId);
        }

        Map<String, String> headers = new LinkedHashMap<>(handlerHeaders);
        if (exchange.rateLimit.isLimited()) {
            headers.put(RATE_LIMIT_LIMIT_HEADER, String.valueOf(exchange.rateLimit.limit()));
            headers.put(RATE_LIMIT_REMAINING_HEADER, String.valueOf(exchange.rateLimit.remaining()));
        }
        headers.put(REQUEST_ID_HEADER, requestId);
        headers.put(PROCESSING_TIME_HEADER, String.valueOf(processingTimeMs));
        headers.put(CACHED_HEADER, String.valueOf(cached));

        return new GatewayResponse(status, headers, body,
                new ResponseMetadata(requestId, processingTimeMs, cached));
    }

    private void logResponseSize(EndpointDefinition endpoint, int status, Object body, String requestId) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            int size = body == null ? 0 : objectMapper.writeValueAsBytes(body).length;
            log.debug("Response {} for {} size={}B requestId={}", status, endpoint.key(), size, requestId);
        } catch (JsonProcessingException e) {
            log.debug("Response {} for {} is not serializable: {}", status, endpoint.key(), e.getMessage());
        }
    }
}
