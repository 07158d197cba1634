package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SessionExtractor implements CredentialExtractor {

    static final String SESSION_HEADER = "x-session-id";

    private final IdentityValidator identityValidator;

    public SessionExtractor(IdentityValidator identityValidator) {
        this.identityValidator = identityValidator;
    }

    @Override
    public AuthMethod method() {
        return AuthMethod.SESSION;
    }

    @Override
    public Optional<String> credential(ValidatedRequest request) {
        return Optional.ofNullable(request.header(SESSION_HEADER)).filter(id -> !id.isBlank());
    }

    @Override
    public Optional<Authentication> authenticate(String credential) {
        return identityValidator.validateSession(credential);
    }
}
