package com.storefront.request_gateway.endpoint;

import java.util.Map;

/**
 * A resolved endpoint together with the parameters captured from the request path.
 */
public record EndpointMatch(EndpointDefinition definition, Map<String, String> pathParams) {

    public EndpointMatch {
        pathParams = Map.copyOf(pathParams);
    }
}
