package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.config.GatewayProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Issues and verifies the bearer tokens the gateway accepts.
 *
 * Tokens are HS256-signed JWTs:
 * <pre>
 *   Payload: {"sub": "3f0c...",              principal id
 *             "email": "ana@example.com",
 *             "roles": ["customer"],
 *             "permissions": ["create:orders"],
 *             "iat": 1700000000,
 *             "exp": 1700003600}
 * </pre>
 *
 * The signing key comes from {@code gateway.auth.jwt-secret} and must be shared by every
 * service that issues tokens for the storefront.
 */
@Component
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final String EMAIL_CLAIM = "email";
    static final String ROLES_CLAIM = "roles";
    static final String PERMISSIONS_CLAIM = "permissions";

    private final SecretKey key;
    private final Duration tokenTtl;
    private final Clock clock;

    public JwtTokenService(GatewayProperties properties, Clock clock) {
        this.key = new SecretKeySpec(
                properties.getAuth().getJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.tokenTtl = properties.getAuth().getTokenTtl();
        this.clock = clock;
    }

    public String issue(Principal principal) {
        Date now = Date.from(clock.instant());
        return Jwts.builder()
                .subject(principal.id())
                .claim(EMAIL_CLAIM, principal.email())
                .claim(ROLES_CLAIM, principal.sortedRoles())
                .claim(PERMISSIONS_CLAIM, principal.sortedPermissions())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + tokenTtl.toMillis()))
                .signWith(key)
                .compact();
    }

    /**
     * Verifies the signature and expiry and rebuilds the principal from the claims.
     *
     * @return empty for a tampered, expired or malformed token
     */
    public Optional<Principal> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                log.debug("Rejected bearer token without subject");
                return Optional.empty();
            }
            return Optional.of(new Principal(
                    claims.getSubject(),
                    claims.get(EMAIL_CLAIM, String.class),
                    toStrings(claims.get(ROLES_CLAIM)),
                    toStrings(claims.get(PERMISSIONS_CLAIM))));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Set<String> toStrings(Object claim) {
        Set<String> values = new LinkedHashSet<>();
        if (claim instanceof Collection<?> collection) {
            collection.forEach(item -> values.add(String.valueOf(item)));
        }
        return values;
    }
}
