package com.storefront.request_gateway.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * JSON body returned for every failed request.
 *
 * Only {@code code}, {@code message} and {@code requestId} are always present;
 * the remaining fields depend on the error kind and are omitted when null.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(
        String code,
        String message,
        String requestId,
        String field,
        String constraint,
        String method,
        List<String> required,
        List<String> actual,
        Long retryAfter,
        Integer limit,
        Long windowMs
) {}
