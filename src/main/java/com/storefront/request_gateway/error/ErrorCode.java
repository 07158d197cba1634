package com.storefront.request_gateway.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every failure kind the gateway can return, with its transport status and the
 * message shown to callers when the exception does not supply its own.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid request data"),
    AUTHENTICATION_ERROR(HttpStatus.UNAUTHORIZED, "Authentication required"),
    AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN, "Access denied"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Endpoint not found"),
    RATE_LIMIT_ERROR(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An internal error occurred"),
    TIMEOUT_ERROR(HttpStatus.GATEWAY_TIMEOUT, "Request timed out");

    private final HttpStatus status;
    private final String defaultMessage;
}
