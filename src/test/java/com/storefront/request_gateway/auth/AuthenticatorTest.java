package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.error.AuthenticationException;
import com.storefront.request_gateway.gateway.HandlerResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.bind.annotation.RequestMethod;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.storefront.request_gateway.support.TestRequests.principal;
import static com.storefront.request_gateway.support.TestRequests.validated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Authenticator")
class AuthenticatorTest {

    @Mock
    private IdentityValidator identityValidator;

    private Authenticator authenticator;

    private final Principal ana = principal("ana", Set.of("customer"), Set.of("create:orders"));

    @BeforeEach
    void setUp() {
        authenticator = new Authenticator(List.of(
                new BearerTokenExtractor(identityValidator),
                new SessionExtractor(identityValidator),
                new ApiKeyExtractor(identityValidator)));
    }

    private static EndpointDefinition endpoint(AuthenticationConfig authentication) {
        return EndpointDefinition.builder()
                .method(RequestMethod.GET)
                .path("/api/secure")
                .authentication(authentication)
                .handler((request, context) -> HandlerResponse.ok(null))
                .build();
    }

    @Test
    @DisplayName("a valid bearer token resolves the principal")
    void bearer() {
        when(identityValidator.validateToken("good")).thenReturn(Optional.of(ana));

        Authentication result = authenticator.authenticate(
                endpoint(AuthenticationConfig.requiring(AuthMethod.BEARER)),
                validated(Map.of("Authorization", "Bearer good")));

        assertThat(result.principal()).isEqualTo(ana);
        assertThat(result.method()).isEqualTo(AuthMethod.BEARER);
    }

    @Test
    @DisplayName("methods are tried in order and an invalid credential falls through to the next")
    void fallsThroughToNextMethod() {
        Session session = new Session("s1", "ana", Instant.EPOCH, Instant.EPOCH);
        when(identityValidator.validateToken("stale")).thenReturn(Optional.empty());
        when(identityValidator.validateSession("s1"))
                .thenReturn(Optional.of(new Authentication(ana, session, AuthMethod.SESSION)));

        Authentication result = authenticator.authenticate(
                endpoint(AuthenticationConfig.requiring(AuthMethod.BEARER, AuthMethod.SESSION)),
                validated(Map.of("Authorization", "Bearer stale", "X-Session-Id", "s1")));

        assertThat(result.session()).isEqualTo(session);
        assertThat(result.method()).isEqualTo(AuthMethod.SESSION);
    }

    @Test
    @DisplayName("no credential on a required endpoint fails with method none")
    void noCredential() {
        assertThatThrownBy(() -> authenticator.authenticate(
                endpoint(AuthenticationConfig.requiring(AuthMethod.BEARER, AuthMethod.SESSION)),
                validated(Map.of())))
                .isInstanceOfSatisfying(AuthenticationException.class, e -> {
                    assertThat(e.getMethod()).isEqualTo("none");
                    assertThat(e.getMessage()).isEqualTo("Authentication required");
                });
    }

    @Test
    @DisplayName("an invalid credential names the method that was presented")
    void invalidCredential() {
        when(identityValidator.validateApiKey("wrong")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authenticator.authenticate(
                endpoint(AuthenticationConfig.requiring()),
                validated(Map.of("X-Api-Key", "wrong"))))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.getMethod()).isEqualTo("api_key"));
    }

    @Test
    @DisplayName("anonymous callers pass where the endpoint allows them")
    void anonymous() {
        Authentication result = authenticator.authenticate(
                endpoint(AuthenticationConfig.anonymousAllowing(AuthMethod.BEARER)),
                validated(Map.of()));

        assertThat(result.principal().isAnonymous()).isTrue();
        assertThat(result.principal().hasRole("anonymous")).isTrue();
        assertThat(result.principal().permissions()).isEmpty();
    }

    @Test
    @DisplayName("credentials for methods the endpoint does not accept are ignored")
    void ignoresUnacceptedMethods() {
        assertThatThrownBy(() -> authenticator.authenticate(
                endpoint(AuthenticationConfig.requiring(AuthMethod.SESSION)),
                validated(Map.of("X-Api-Key", "key"))))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.getMethod()).isEqualTo("none"));
        verify(identityValidator, never()).validateApiKey(anyString());
    }

    @Test
    @DisplayName("session-only endpoints ignore valid bearer tokens")
    void sessionOnly() {
        assertThatThrownBy(() -> authenticator.authenticate(
                endpoint(AuthenticationConfig.sessionOnly()),
                validated(Map.of("Authorization", "Bearer good"))))
                .isInstanceOf(AuthenticationException.class);
        verify(identityValidator, never()).validateToken(anyString());
    }
}
