package com.storefront.request_gateway.error;

import lombok.Getter;

/**
 * A request section failed its declared constraints.
 *
 * {@code field} is the section name followed by the path inside it, e.g.
 * {@code body.shippingAddress.city}, or just {@code body} for a malformed payload.
 */
@Getter
public class ValidationException extends GatewayException {

    private final String field;
    private final String constraint;

    public ValidationException(String message, String field, String constraint) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = field;
        this.constraint = constraint;
    }

    @Override
    protected void describe(ErrorEnvelope.ErrorEnvelopeBuilder envelope) {
        envelope.field(field).constraint(constraint);
    }
}
