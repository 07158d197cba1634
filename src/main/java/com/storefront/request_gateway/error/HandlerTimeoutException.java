package com.storefront.request_gateway.error;

import lombok.Getter;

import java.time.Duration;

/**
 * The endpoint handler did not finish within its time limit and was cancelled.
 */
@Getter
public class HandlerTimeoutException extends GatewayException {

    private final Duration timeout;

    public HandlerTimeoutException(Duration timeout) {
        super(ErrorCode.TIMEOUT_ERROR, "Handler did not complete within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }
}
