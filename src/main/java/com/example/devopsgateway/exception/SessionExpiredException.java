package com.example.devopsgateway.exception;

/**
 * The identity provider reported the session token as expired.
 * The principal resolver answers this with a single refresh attempt.
 */
public class SessionExpiredException extends AuthenticationException {

    public SessionExpiredException(String message) {
        super(message);
    }
}
