package com.storefront.request_gateway.auth;

import java.time.Instant;

/**
 * A server-side login session, resolved from the {@code x-session-id} header.
 */
public record Session(String id, String userId, Instant createdAt, Instant lastActivity) {

    public Session touch(Instant now) {
        return new Session(id, userId, createdAt, now);
    }
}
