package com.storefront.request_gateway.proxy;

import com.storefront.request_gateway.error.ErrorEnvelope;

/**
 * Wire shape of a failed request: {@code {"error": {...}}}.
 */
public record ErrorResponse(ErrorEnvelope error) {}
