package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure of the proxied audit-gateway transport. Write operations recover
 * from it by falling back to the direct router; reads only log it.
 */
public class GatewayException extends GatewayApiException {

    public GatewayException(String message) {
        super(HttpStatus.BAD_GATEWAY, "gateway_error", message);
    }

    public GatewayException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "gateway_error", message, cause);
    }
}
