package com.storefront.request_gateway.cache;

/**
 * Request parts that distinguish cache entries of one endpoint.
 */
public enum VaryDimension {
    QUERY,
    PARAMS,
    PRINCIPAL
}
