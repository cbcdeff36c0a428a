package com.example.devopsgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * The identity provider could not be reached or answered with a server error.
 */
public class IdentityProviderUnavailableException extends GatewayApiException {

    public IdentityProviderUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "identity_provider_unavailable", message);
    }

    public IdentityProviderUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "identity_provider_unavailable", message, cause);
    }
}
