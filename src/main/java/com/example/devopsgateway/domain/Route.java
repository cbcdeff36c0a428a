package com.example.devopsgateway.domain;

/**
 * Which path served a routed operation.
 */
public enum Route {
    /** In-process services */
    DIRECT,
    /** External audit gateway */
    PROXIED,
    /** Proxied call failed, served in-process */
    FALLBACK,
    /** Placeholder returned, real call running in the background */
    OPTIMISTIC
}
