package com.example.devopsgateway.security;

public enum PermissionMode {
    /** At least one required value must be held */
    ANY,
    /** Every required value must be held */
    ALL
}
