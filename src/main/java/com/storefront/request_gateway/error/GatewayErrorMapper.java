package com.storefront.request_gateway.error;

import org.springframework.stereotype.Component;

/**
 * Converts pipeline exceptions into the caller-facing error envelope.
 *
 * Anything that is not a {@link GatewayException} is treated as internal: the
 * envelope gets the generic message and none of the original detail.
 */
@Component
public class GatewayErrorMapper {

    public GatewayException classify(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        return new InternalGatewayException(error);
    }

    public ErrorEnvelope toEnvelope(GatewayException error, String requestId) {
        ErrorEnvelope.ErrorEnvelopeBuilder builder = ErrorEnvelope.builder()
                .code(error.getErrorCode().name())
                .requestId(requestId);
        if (error instanceof InternalGatewayException) {
            builder.message(ErrorCode.INTERNAL_ERROR.getDefaultMessage());
        } else {
            builder.message(error.getMessage());
        }
        error.describe(builder);
        return builder.build();
    }
}
