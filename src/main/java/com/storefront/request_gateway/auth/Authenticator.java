package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.error.AuthenticationException;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the principal for a request.
 *
 * The endpoint's methods are tried in order and the first valid credential wins. If
 * none is valid the caller proceeds as {@link Principal#ANONYMOUS} when the endpoint
 * permits it; otherwise the request fails naming the first method whose credential
 * was presented, or {@code none} if the caller sent nothing.
 */
@Component
public class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    static final String NO_METHOD = "none";

    private final Map<AuthMethod, CredentialExtractor> extractors = new EnumMap<>(AuthMethod.class);

    public Authenticator(List<CredentialExtractor> extractors) {
        for (CredentialExtractor extractor : extractors) {
            this.extractors.put(extractor.method(), extractor);
        }
    }

    public Authentication authenticate(EndpointDefinition endpoint, ValidatedRequest request) {
        AuthenticationConfig config = endpoint.authentication();
        List<AuthMethod> methods = config.sessionRequired() ? List.of(AuthMethod.SESSION) : config.methods();

        AuthMethod firstPresented = null;
        for (AuthMethod method : methods) {
            CredentialExtractor extractor = extractors.get(method);
            if (extractor == null) {
                continue;
            }
            Optional<String> credential = extractor.credential(request);
            if (credential.isEmpty()) {
                continue;
            }
            if (firstPresented == null) {
                firstPresented = method;
            }
            Optional<Authentication> authentication = extractor.authenticate(credential.get());
            if (authentication.isPresent()) {
                log.debug("Authenticated principal={} via {} for {}",
                        authentication.get().principal().id(), method.label(), endpoint.key());
                return authentication.get();
            }
        }

        if (!config.sessionRequired() && config.anonymousPermitted()) {
            return Authentication.anonymous();
        }

        String method = firstPresented == null ? NO_METHOD : firstPresented.label();
        log.warn("Authentication failed for {} method={}", endpoint.key(), method);
        throw new AuthenticationException(
                firstPresented == null ? "Authentication required" : "Invalid or expired " + method + " credential",
                method);
    }
}
