package com.storefront.request_gateway.validation;

/**
 * Request types for each section. Every section is bound to its type and checked with
 * Bean Validation; a null type leaves that section unchecked.
 */
public record ValidationConfig(Class<?> params, Class<?> query, Class<?> body, Class<?> headers) {

    public static ValidationConfig none() {
        return new ValidationConfig(null, null, null, null);
    }

    public static ValidationConfig body(Class<?> body) {
        return new ValidationConfig(null, null, body, null);
    }

    public static ValidationConfig query(Class<?> query) {
        return new ValidationConfig(null, query, null, null);
    }

    public static ValidationConfig params(Class<?> params) {
        return new ValidationConfig(params, null, null, null);
    }
}
