package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ApiKeyExtractor implements CredentialExtractor {

    static final String API_KEY_HEADER = "x-api-key";

    private final IdentityValidator identityValidator;

    public ApiKeyExtractor(IdentityValidator identityValidator) {
        this.identityValidator = identityValidator;
    }

    @Override
    public AuthMethod method() {
        return AuthMethod.API_KEY;
    }

    @Override
    public Optional<String> credential(ValidatedRequest request) {
        return Optional.ofNullable(request.header(API_KEY_HEADER)).filter(key -> !key.isBlank());
    }

    @Override
    public Optional<Authentication> authenticate(String credential) {
        return identityValidator.validateApiKey(credential)
                .map(principal -> Authentication.of(principal, AuthMethod.API_KEY));
    }
}
