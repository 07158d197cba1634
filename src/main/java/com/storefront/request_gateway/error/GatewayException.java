package com.storefront.request_gateway.error;

import lombok.Getter;

/**
 * Base type of every failure raised inside the request pipeline.
 *
 * Each stage throws its own subclass; the orchestrator stops at the first one and
 * turns it into an {@link ErrorEnvelope} through {@link GatewayErrorMapper}.
 * Handlers may throw these too; anything else they throw is wrapped as an
 * {@link InternalGatewayException}.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message == null || message.isBlank() ? errorCode.getDefaultMessage() : message);
        this.errorCode = errorCode;
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message == null || message.isBlank() ? errorCode.getDefaultMessage() : message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Adds the kind-specific fields (field, retryAfter, required/actual, ...) to the envelope.
     * The base fields are filled in by the mapper.
     */
    protected void describe(ErrorEnvelope.ErrorEnvelopeBuilder envelope) {
    }
}
