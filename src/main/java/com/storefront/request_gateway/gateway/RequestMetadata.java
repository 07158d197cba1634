package com.storefront.request_gateway.gateway;

import java.time.Instant;

public record RequestMetadata(String requestId, Instant receivedAt) {}
