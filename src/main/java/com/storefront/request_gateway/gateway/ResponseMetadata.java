package com.storefront.request_gateway.gateway;

public record ResponseMetadata(String requestId, long processingTimeMs, boolean cached) {}
