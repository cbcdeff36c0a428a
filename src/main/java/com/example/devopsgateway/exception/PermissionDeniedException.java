package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends GatewayApiException {

    public PermissionDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, "permission_denied", message);
    }
}
