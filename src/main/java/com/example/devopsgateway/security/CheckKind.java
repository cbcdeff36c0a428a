package com.example.devopsgateway.security;

/**
 * What a delegated identity-provider check validates.
 */
public enum CheckKind {
    ROLE, PERMISSION
}
