package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.config.GatewayProperties;
import com.storefront.request_gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static com.storefront.request_gateway.support.TestRequests.principal;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemorySessionStore")
class InMemorySessionStoreTest {

    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        GatewayProperties properties = new GatewayProperties();
        properties.getAuth().setSessionIdleTimeout(Duration.ofMinutes(30));
        store = new InMemorySessionStore(properties, clock);
    }

    @Test
    @DisplayName("activity keeps a session alive past the idle timeout")
    void touchExtends() {
        Session session = store.create(principal("ana", Set.of("customer"), Set.of()));

        clock.advance(Duration.ofMinutes(20));
        assertThat(store.touch(session.id())).isPresent();
        clock.advance(Duration.ofMinutes(20));

        assertThat(store.touch(session.id())).hasValueSatisfying(auth -> {
            assertThat(auth.principal().id()).isEqualTo("ana");
            assertThat(auth.method()).isEqualTo(AuthMethod.SESSION);
            assertThat(auth.session().lastActivity()).isEqualTo(clock.instant());
        });
    }

    @Test
    @DisplayName("an idle session expires")
    void idleExpires() {
        Session session = store.create(principal("ana", Set.of(), Set.of()));

        clock.advance(Duration.ofMinutes(30));

        assertThat(store.touch(session.id())).isEmpty();
    }

    @Test
    @DisplayName("invalidated and unknown sessions are absent")
    void invalidate() {
        Session session = store.create(principal("ana", Set.of(), Set.of()));

        store.invalidate(session.id());

        assertThat(store.touch(session.id())).isEmpty();
        assertThat(store.touch("no-such-session")).isEmpty();
    }
}
