package com.storefront.request_gateway.auth;

import com.storefront.request_gateway.gateway.ValidatedRequest;

import java.util.Optional;

/**
 * Reads one kind of credential from a request and checks it.
 */
public interface CredentialExtractor {

    AuthMethod method();

    /** The raw credential, if the request carries one in this extractor's location. */
    Optional<String> credential(ValidatedRequest request);

    /** Empty when the credential is not valid. */
    Optional<Authentication> authenticate(String credential);
}
