package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bearer tokens through {@link JwtTokenService}, sessions through
 * {@link InMemorySessionStore}, API keys from {@code gateway.auth.api-keys}.
 */
@Component
public class DefaultIdentityValidator implements IdentityValidator {

    private final JwtTokenService tokenService;
    private final InMemorySessionStore sessionStore;
    private final Map<String, Principal> apiKeys = new HashMap<>();

    public DefaultIdentityValidator(JwtTokenService tokenService,
                                    InMemorySessionStore sessionStore,
                                    GatewayProperties properties) {
        this.tokenService = tokenService;
        this.sessionStore = sessionStore;
        for (GatewayProperties.ApiKey apiKey : properties.getAuth().getApiKeys()) {
            apiKeys.put(apiKey.getKey(),
                    new Principal(apiKey.getPrincipalId(), null, apiKey.getRoles(), apiKey.getPermissions()));
        }
    }

    @Override
    public Optional<Principal> validateToken(String token) {
        return tokenService.verify(token);
    }

    @Override
    public Optional<Authentication> validateSession(String sessionId) {
        return sessionStore.touch(sessionId);
    }

    @Override
    public Optional<Principal> validateApiKey(String apiKey) {
        return Optional.ofNullable(apiKeys.get(apiKey));
    }
}
