package com.storefront.request_gateway.gateway;

import com.storefront.request_gateway.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.storefront.request_gateway.support.TestRequests.raw;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestContextFactory")
class RequestContextFactoryTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final RequestContextFactory factory = new RequestContextFactory(clock);

    @Test
    @DisplayName("the first X-Forwarded-For entry is the client")
    void forwardedFor() {
        RawRequest request = raw("GET", "/api/products")
                .headers(Map.of("X-Forwarded-For", "203.0.113.7, 10.1.1.1, 10.2.2.2", "X-Real-IP", "198.51.100.1"))
                .build();

        assertThat(factory.create(request).clientAddress()).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("X-Real-IP, then the remote address, then nothing")
    void fallbacks() {
        assertThat(RequestContextFactory.extractClientIp(raw("GET", "/").headers(Map.of("X-Real-IP", "198.51.100.1"))
                .build())).isEqualTo("198.51.100.1");
        assertThat(RequestContextFactory.extractClientIp(raw("GET", "/").build())).isEqualTo("10.0.0.1");
        assertThat(RequestContextFactory.extractClientIp(raw("GET", "/").remoteAddress(null).build())).isNull();
    }

    @Test
    @DisplayName("request ids are unique and trace ids are propagated when supplied")
    void identifiers() {
        RawRequest traced = raw("GET", "/api/products")
                .headers(Map.of("X-Trace-Id", "abc123", "X-Parent-Span-Id", "parent", "User-Agent", "curl/8"))
                .build();

        RequestContext first = factory.create(traced);
        RequestContext second = factory.create(raw("GET", "/api/products").build());

        assertThat(first.requestId()).startsWith("req_").isNotEqualTo(second.requestId());
        assertThat(first.correlation().traceId()).isEqualTo("abc123");
        assertThat(first.correlation().parentSpanId()).isEqualTo("parent");
        assertThat(first.correlation().spanId()).hasSize(16);
        assertThat(first.userAgent()).isEqualTo("curl/8");
        assertThat(first.timestamp()).isEqualTo(clock.instant());
        assertThat(second.correlation().traceId()).hasSize(32);
        assertThat(second.userAgent()).isEmpty();
    }
}
