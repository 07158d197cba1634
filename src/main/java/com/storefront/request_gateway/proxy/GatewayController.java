package com.storefront.request_gateway.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.request_gateway.error.ErrorEnvelope;
import com.storefront.request_gateway.gateway.GatewayOrchestrator;
import com.storefront.request_gateway.gateway.GatewayResponse;
import com.storefront.request_gateway.gateway.RawRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catch-all controller for the storefront API.
 *
 * Every request under /api is converted to a {@link RawRequest}, handed to the
 * {@link GatewayOrchestrator}, and the resulting status, headers and JSON body are
 * written back to the caller. Routing, validation and the rest of the pipeline happen
 * in the orchestrator, not in Spring MVC.
 *
 * @Order(LOWEST_PRECEDENCE) lets explicit mappings such as the admin API resolve first.
 */
@RestController
@Order(Ordered.LOWEST_PRECEDENCE)
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    private final GatewayOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public GatewayController(GatewayOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    /**
     * Steps:
     * 1. Copy method, path, query parameters, headers and body into a RawRequest.
     * 2. Run the gateway pipeline.
     * 3. Write status and headers, then the handler body or the error envelope.
     */
    @RequestMapping("/api/**")
    public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException {

        // --- Step 1: Build the raw request ---
        RawRequest raw = toRawRequest(request);
        log.debug("Gateway request {} {}", raw.method(), raw.path());

        // --- Step 2: Run the pipeline ---
        GatewayResponse result = orchestrator.handleRequest(raw);

        // --- Step 3: Write the response ---
        response.setStatus(result.status());
        result.headers().forEach(response::setHeader);

        Object body = result.body();
        if (body instanceof ErrorEnvelope envelope) {
            body = new ErrorResponse(envelope);
        }
        if (body != null) {
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(), body);
        }
    }

    private RawRequest toRawRequest(HttpServletRequest request) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> headerNames = request.getHeaderNames();
        while (headerNames.hasMoreElements()) {
            String headerName = headerNames.nextElement();
            headers.put(headerName, request.getHeader(headerName));
        }

        // First value wins for repeated query parameters.
        Map<String, String> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                query.put(name, values[0]);
            }
        });

        String body = StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
        String queryString = request.getQueryString();

        return RawRequest.builder()
                .method(request.getMethod())
                .path(request.getRequestURI())
                .url(request.getRequestURI() + (queryString != null ? "?" + queryString : ""))
                .query(query)
                .headers(headers)
                .body(body.isEmpty() ? null : body)
                .remoteAddress(request.getRemoteAddr())
                .build();
    }
}
