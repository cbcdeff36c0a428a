package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing, invalid or expired credential. Not recoverable without re-authentication.
 */
public class AuthenticationException extends GatewayApiException {

    public AuthenticationException(String message) {
        super(HttpStatus.UNAUTHORIZED, "authentication_failed", message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "authentication_failed", message, cause);
    }
}
