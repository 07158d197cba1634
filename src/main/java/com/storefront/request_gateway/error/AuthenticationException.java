package com.storefront.request_gateway.error;

import lombok.Getter;

/**
 * No configured credential method produced a principal and anonymous access is not allowed.
 */
@Getter
public class AuthenticationException extends GatewayException {

    /** The credential method that was attempted, or {@code none}. */
    private final String method;

    public AuthenticationException(String message, String method) {
        super(ErrorCode.AUTHENTICATION_ERROR, message);
        this.method = method;
    }

    @Override
    protected void describe(ErrorEnvelope.ErrorEnvelopeBuilder envelope) {
        envelope.method(method);
    }
}
