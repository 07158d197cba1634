package com.storefront.request_gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything under {@code gateway.*} in application.yaml.
 * Bound and validated at startup; an invalid value stops the application.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** Reported by the admin API. */
    @NotBlank
    private String version = "1.0.0";

    /** Used for endpoints that do not declare their own timeout. */
    @NotNull
    private Duration handlerTimeout = Duration.ofSeconds(30);

    /** Size of the pool handlers run on. */
    @Min(1)
    private int handlerThreads = 32;

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final Metrics metrics = new Metrics();

    @Valid
    private final Auth auth = new Auth();

    @Valid
    private final Monitoring monitoring = new Monitoring();

    @Getter
    @Setter
    public static class RateLimit {

        /** {@code in-memory} (per instance) or {@code redis} (shared). */
        @Pattern(regexp = "in-memory|redis")
        private String store = "in-memory";

        @Min(1000)
        private long purgeIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Cache {

        /** Entries are evicted by the cache size policy past this size. */
        @Min(1)
        private int maxEntries = 10_000;

        @Min(1000)
        private long purgeIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Metrics {

        /** Latency samples kept per endpoint (and globally). */
        @Min(1)
        private int sampleCapacity = 1000;

        @Min(1000)
        private long emitIntervalMs = 30_000;

        @Min(1)
        private int errorLogCapacity = 100;
    }

    @Getter
    @Setter
    public static class Auth {

        /** HMAC-SHA256 key for bearer tokens; at least 256 bits. */
        @NotBlank
        @Size(min = 32)
        private String jwtSecret = "change-me-storefront-gateway-dev-secret-0123456789";

        @NotNull
        private Duration tokenTtl = Duration.ofHours(1);

        @NotNull
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);

        @Valid
        private List<ApiKey> apiKeys = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class ApiKey {

        @NotBlank
        private String key;

        @NotBlank
        private String principalId;

        private Set<String> roles = new LinkedHashSet<>();

        private Set<String> permissions = new LinkedHashSet<>();
    }

    @Getter
    @Setter
    public static class Monitoring {

        @Valid
        private final Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Kafka {

        private boolean enabled = false;

        @NotBlank
        private String accessLogTopic = "gateway.access-logs";

        @NotBlank
        private String metricsTopic = "gateway.metrics";

        @NotBlank
        private String errorsTopic = "gateway.errors";

        @NotBlank
        private String alertsTopic = "gateway.alerts";
    }
}
