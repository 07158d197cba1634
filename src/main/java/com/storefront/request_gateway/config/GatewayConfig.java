package com.storefront.request_gateway.config;

import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans shared by the pipeline stages.
 *
 * Scheduling is enabled here for the rate-limit, cache and session purges and for the
 * periodic metrics emit.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    /** Every time-dependent stage reads this clock; tests replace it. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool that endpoint handlers run on. Shut down with interruption so a stuck
     * handler cannot hold up application shutdown.
     */
    @Bean(name = "handlerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService handlerExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(properties.getHandlerThreads(),
                new CustomizableThreadFactory("gateway-handler-"));
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(GatewayProperties properties) {
        return TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(properties.getHandlerTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    /** Publishes per-endpoint time limiter calls (successful, failed, timed out) to Micrometer. */
    @Bean
    public MeterBinder timeLimiterMetrics(TimeLimiterRegistry timeLimiterRegistry) {
        return TaggedTimeLimiterMetrics.ofTimeLimiterRegistry(timeLimiterRegistry);
    }
}
