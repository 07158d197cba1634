package com.storefront.request_gateway.cache;

import com.storefront.request_gateway.gateway.RequestContext;
import com.storefront.request_gateway.gateway.ValidatedRequest;

/**
 * Endpoint-supplied cache key, used instead of the generated one.
 */
@FunctionalInterface
public interface CacheKeyFunction {

    String key(ValidatedRequest request, RequestContext context);
}
