package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

public class InternalException extends GatewayApiException {

    public InternalException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", message);
    }

    public InternalException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", message, cause);
    }
}
