package com.storefront.request_gateway.error;

/**
 * Wraps an unexpected failure. The cause is kept for server-side logging only;
 * callers always see the generic message.
 */
public class InternalGatewayException extends GatewayException {

    public InternalGatewayException(Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, null, cause);
    }
}
