package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@code Authorization: Bearer <jwt>}.
 */
@Component
public class BearerTokenExtractor implements CredentialExtractor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityValidator identityValidator;

    public BearerTokenExtractor(IdentityValidator identityValidator) {
        this.identityValidator = identityValidator;
    }

    @Override
    public AuthMethod method() {
        return AuthMethod.BEARER;
    }

    @Override
    public Optional<String> credential(ValidatedRequest request) {
        String header = request.header("authorization");
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        }
        return Optional.empty();
    }

    @Override
    public Optional<Authentication> authenticate(String credential) {
        return identityValidator.validateToken(credential)
                .map(principal -> Authentication.of(principal, AuthMethod.BEARER));
    }
}
