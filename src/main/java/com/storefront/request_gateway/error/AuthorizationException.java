package com.storefront.request_gateway.error;

import lombok.Getter;

import java.util.List;

/**
 * The principal failed one of the endpoint's authorization checks.
 * Carries what the check required and what the principal actually had.
 */
@Getter
public class AuthorizationException extends GatewayException {

    private final List<String> required;
    private final List<String> actual;

    public AuthorizationException(String message, List<String> required, List<String> actual) {
        super(ErrorCode.AUTHORIZATION_ERROR, message);
        this.required = List.copyOf(required);
        this.actual = List.copyOf(actual);
    }

    @Override
    protected void describe(ErrorEnvelope.ErrorEnvelopeBuilder envelope) {
        envelope.required(required).actual(actual);
    }
}
