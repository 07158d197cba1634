package com.storefront.request_gateway.endpoint;

import com.storefront.request_gateway.gateway.HandlerResponse;
import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;

/**
 * Business logic behind one endpoint. Runs only after every pipeline stage has passed.
 *
 * A handler may throw a {@link com.storefront.request_gateway.error.GatewayException}
 * to return a specific error; any other exception becomes an internal error.
 */
@FunctionalInterface
public interface EndpointHandler {

    HandlerResponse handle(ValidatedRequest request, RequestContext context) throws Exception;
}
