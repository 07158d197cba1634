package com.storefront.request_gateway.error;

public class EndpointNotFoundException extends GatewayException {

    public EndpointNotFoundException(String method, String path) {
        super(ErrorCode.NOT_FOUND, "No endpoint registered for " + method + " " + path);
    }
}
