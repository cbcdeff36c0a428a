package com.example.devopsgateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Root of the gateway error taxonomy. Each subtype carries the HTTP status
 * and machine-readable code it is reported with.
 */
@Getter
public abstract class GatewayApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected GatewayApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected GatewayApiException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
