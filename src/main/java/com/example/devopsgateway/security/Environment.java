package com.example.devopsgateway.security;

import com.example.devopsgateway.exception.ValidationException;

import java.util.Locale;

/**
 * Target environment of a deploy or rollback.
 */
public enum Environment {
    PRODUCTION("production"),
    STAGING("staging");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse an environment argument. Unknown values are a validation failure, not a denial.
     */
    public static Environment parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (Environment env : values()) {
                if (env.value.equals(normalized)) {
                    return env;
                }
            }
        }
        throw new ValidationException("Invalid environment '" + raw + "'. Must be 'staging' or 'production'");
    }
}
