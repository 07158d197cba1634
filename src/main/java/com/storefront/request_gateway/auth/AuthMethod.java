package com.storefront.request_gateway.auth;

/**
 * Credential forms an endpoint may accept, tried in the order the endpoint lists them.
 */
public enum AuthMethod {
    BEARER("bearer"),
    SESSION("session"),
    API_KEY("api_key");

    private final String label;

    AuthMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
