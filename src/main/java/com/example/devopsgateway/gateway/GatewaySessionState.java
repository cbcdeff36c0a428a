package com.example.devopsgateway.gateway;

/**
 * Handshake state of the proxied gateway transport.
 */
public enum GatewaySessionState {
    UNINITIALIZED, INITIALIZING, READY
}
