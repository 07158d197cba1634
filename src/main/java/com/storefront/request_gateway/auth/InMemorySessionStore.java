package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Login sessions kept in process memory. A session expires after
 * {@code gateway.auth.session-idle-timeout} without activity; every successful lookup
 * moves its last-activity time forward.
 */
@Component
public class InMemorySessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private record StoredSession(Session session, Principal principal) {}

    private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();
    private final Duration idleTimeout;
    private final Clock clock;

    public InMemorySessionStore(GatewayProperties properties, Clock clock) {
        this.idleTimeout = properties.getAuth().getSessionIdleTimeout();
        this.clock = clock;
    }

    public Session create(Principal principal) {
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), principal.id(), now, now);
        sessions.put(session.id(), new StoredSession(session, principal));
        log.debug("Created session for principal={}", principal.id());
        return session;
    }

    /**
     * Returns the live session and refreshes its activity time. An idle session is
     * removed and reported as absent.
     */
    public Optional<Authentication> touch(String sessionId) {
        Instant now = clock.instant();
        StoredSession stored = sessions.computeIfPresent(sessionId, (id, current) -> {
            if (isIdle(current.session(), now)) {
                return null;
            }
            return new StoredSession(current.session().touch(now), current.principal());
        });
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new Authentication(stored.principal(), stored.session(), AuthMethod.SESSION));
    }

    public void invalidate(String sessionId) {
        sessions.remove(sessionId);
    }

    @Scheduled(fixedDelayString = "60000")
    public void purgeIdle() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(stored -> isIdle(stored.session(), now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.debug("Purged {} idle sessions", removed);
        }
    }

    private boolean isIdle(Session session, Instant now) {
        return !session.lastActivity().plus(idleTimeout).isAfter(now);
    }
}
