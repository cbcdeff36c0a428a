package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed input, e.g. an unknown environment or a too-short rollback reason.
 */
public class ValidationException extends GatewayApiException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }
}
