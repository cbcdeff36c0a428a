package com.example.devopsgateway.security;

import java.util.Map;
import java.util.Set;

/**
 * Narrow view of the external identity provider.
 */
public interface IdentityProvider {

    /**
     * Whether the provider has enough configuration to be called at all.
     */
    boolean isConfigured();

    /**
     * Validate a session token and return its claims.
     *
     * @throws com.example.devopsgateway.exception.SessionExpiredException        token expired
     * @throws com.example.devopsgateway.exception.AuthenticationException        token rejected
     * @throws com.example.devopsgateway.exception.IdentityProviderUnavailableException provider unreachable
     */
    ValidatedSession validate(String sessionToken, String refreshToken);

    /**
     * Exchange a refresh token for a fresh session.
     */
    ValidatedSession refresh(String refreshToken);

    /**
     * End the session owning the refresh token.
     */
    boolean logout(String refreshToken);

    /**
     * Ask the provider to evaluate required roles or permissions against the original claims.
     */
    DelegatedCheckResult delegatedCheck(Map<String, String> claims, Set<String> required,
                                        CheckKind kind, PermissionMode mode);

    record ValidatedSession(Map<String, Object> claims, String sessionToken) {
    }

    record DelegatedCheckResult(boolean valid, Set<String> matched) {

        public static DelegatedCheckResult denied() {
            return new DelegatedCheckResult(false, Set.of());
        }
    }
}
