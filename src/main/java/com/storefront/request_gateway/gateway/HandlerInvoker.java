package com.storefront.request_gateway.gateway;

import com.storefront.request_gateway.config.GatewayProperties;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.error.GatewayException;
import com.storefront.request_gateway.error.HandlerTimeoutException;
import com.storefront.request_gateway.error.InternalGatewayException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Runs endpoint handlers on the handler pool under a per-endpoint time limit.
 *
 * Each endpoint gets its own Resilience4j {@link TimeLimiter}, named after the endpoint
 * and its timeout. A handler that overruns is cancelled with interruption and the
 * request fails with {@link HandlerTimeoutException}.
 */
@Component
public class HandlerInvoker {

    private static final Logger log = LoggerFactory.getLogger(HandlerInvoker.class);

    private final ExecutorService executor;
    private final TimeLimiterRegistry timeLimiters;
    private final Duration defaultTimeout;

    @Autowired
    public HandlerInvoker(@Qualifier("handlerExecutor") ExecutorService executor,
                          TimeLimiterRegistry timeLimiters,
                          GatewayProperties properties) {
        this(executor, timeLimiters, properties.getHandlerTimeout());
    }

    public HandlerInvoker(ExecutorService executor, TimeLimiterRegistry timeLimiters, Duration defaultTimeout) {
        this.executor = executor;
        this.timeLimiters = timeLimiters;
        this.defaultTimeout = defaultTimeout;
    }

    public HandlerResponse invoke(EndpointDefinition endpoint, ValidatedRequest request, RequestContext context) {
        Duration timeout = endpoint.timeout() != null ? endpoint.timeout() : defaultTimeout;
        TimeLimiter timeLimiter = timeLimiters.timeLimiter(
                endpoint.key() + "@" + timeout.toMillis(),
                TimeLimiterConfig.custom()
                        .timeoutDuration(timeout)
                        .cancelRunningFuture(true)
                        .build());

        try {
            HandlerResponse response = timeLimiter.executeFutureSupplier(
                    () -> executor.submit(() -> endpoint.handler().handle(request, context)));
            if (response == null) {
                throw new IllegalStateException("Handler for " + endpoint.key() + " returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            log.warn("Handler for {} exceeded {}ms, cancelled requestId={}",
                    endpoint.key(), timeout.toMillis(), context.requestId());
            throw new HandlerTimeoutException(timeout);
        } catch (GatewayException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalGatewayException(e);
        } catch (Exception e) {
            throw new InternalGatewayException(e);
        }
    }
}
