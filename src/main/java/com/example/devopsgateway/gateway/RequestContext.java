package com.example.devopsgateway.gateway;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

import java.util.UUID;

/**
 * Per-request data a router needs besides the principal: a correlation id and
 * the inbound credentials forwarded verbatim to the proxied gateway.
 */
@Value
@Builder
public class RequestContext {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    String requestId;
    String authorization;
    String cookie;

    public static RequestContext from(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        return RequestContext.builder()
                .requestId(requestId != null && !requestId.isBlank() ? requestId : newRequestId())
                .authorization(request.getHeader(HttpHeaders.AUTHORIZATION))
                .cookie(request.getHeader(HttpHeaders.COOKIE))
                .build();
    }

    /**
     * Context for calls with no inbound HTTP request to forward.
     */
    public static RequestContext internal() {
        return RequestContext.builder().requestId(newRequestId()).build();
    }

    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }
}
