package com.example.devopsgateway.security;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.IdentityProviderUnavailableException;
import com.example.devopsgateway.exception.SessionExpiredException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a session credential into a normalized {@link Principal}.
 *
 * Steps:
 * 1. No token + anonymous access enabled → fixed low-privilege principal (no provider call)
 * 2. Validate with the identity provider, refreshing once on expiry
 * 3. Read identity fields through {@link ClaimRules}
 * 4. Merge direct and tenant-scoped roles/permissions
 * 5. Roles without permissions → expand roles through the {@link PolicyTable}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrincipalResolver {

    private final IdentityProvider identityProvider;
    private final PolicyTable policyTable;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Resolve the principal for an inbound request, honouring anonymous access.
     */
    public Principal resolve(String sessionToken, String refreshToken) {
        if (isBlank(sessionToken)) {
            if (properties.getAuth().isAnonymousEnabled()) {
                return anonymousPrincipal();
            }
            throw new AuthenticationException("Not authenticated");
        }
        return resolveSession(sessionToken, refreshToken);
    }

    /**
     * Resolve strictly from a session token; anonymous access never applies.
     */
    public Principal resolveSession(String sessionToken, String refreshToken) {
        if (isBlank(sessionToken)) {
            throw new AuthenticationException("Session token is required");
        }
        if (!identityProvider.isConfigured()) {
            throw new AuthenticationException("Identity provider not configured");
        }

        IdentityProvider.ValidatedSession session = validate(sessionToken, refreshToken);
        String effectiveToken = session.sessionToken() != null ? session.sessionToken() : sessionToken;
        return fromClaims(session.claims(), effectiveToken, refreshToken);
    }

    /**
     * The synthetic principal used when anonymous access is enabled and no token was sent.
     */
    public Principal anonymousPrincipal() {
        String role = properties.getAuth().getAnonymousRole();
        return Principal.builder()
                .userId(Principal.ANONYMOUS_USER_ID)
                .loginId("anonymous@localhost")
                .name("Anonymous User (" + role + ")")
                .tenant("dev-tenant")
                .role(role)
                .permissions(policyTable.permissionsFor(role))
                .anonymous(true)
                .build();
    }

    /**
     * Builds a principal from claims that were already validated elsewhere, such as
     * the audit gateway's {@code authenticate_user} answer.
     */
    public Principal fromClaims(Map<String, Object> claims, String sessionToken, String refreshToken) {
        String tenant = ClaimRules.firstString(claims, ClaimRules.TENANT).orElse(null);

        Set<String> roles = ClaimRules.collectValues(claims, ClaimRules.ROLES);
        Set<String> permissions = ClaimRules.collectValues(claims, ClaimRules.PERMISSIONS);
        if (tenant != null) {
            roles.addAll(ClaimRules.tenantRoles(claims, tenant));
            permissions.addAll(ClaimRules.tenantPermissions(claims, tenant));
        }

        roles = allowListed(roles, properties.getPolicy().getAvailableRoles());
        permissions = allowListed(permissions, properties.getPolicy().getAvailablePermissions());

        if (permissions.isEmpty() && !roles.isEmpty()) {
            Set<String> derived = policyTable.expand(roles);
            log.info("No direct permissions in claims, derived {} from roles {}", derived, roles);
            permissions.addAll(derived);
        }

        Principal principal = Principal.builder()
                .userId(ClaimRules.firstString(claims, ClaimRules.USER_ID).orElse("unknown"))
                .loginId(ClaimRules.firstString(claims, ClaimRules.LOGIN_ID).orElse(null))
                .email(ClaimRules.firstString(claims, ClaimRules.EMAIL).orElse(null))
                .name(ClaimRules.firstString(claims, ClaimRules.NAME).orElse(null))
                .tenant(tenant)
                .roles(roles)
                .permissions(permissions)
                .token(sessionToken)
                .refreshToken(refreshToken)
                .rawClaims(stringify(claims))
                .anonymous(false)
                .build();

        log.debug("Resolved principal {} roles={} permissions={}",
                principal.getUserId(), principal.getRoles(), principal.getPermissions());
        return principal;
    }

    private IdentityProvider.ValidatedSession validate(String sessionToken, String refreshToken) {
        try {
            return identityProvider.validate(sessionToken, refreshToken);
        } catch (SessionExpiredException e) {
            if (isBlank(refreshToken)) {
                throw e;
            }
            log.info("Session expired, attempting a single refresh");
            return refreshOnce(refreshToken);
        } catch (IdentityProviderUnavailableException e) {
            throw new AuthenticationException("Authentication failed: identity provider unavailable", e);
        }
    }

    private IdentityProvider.ValidatedSession refreshOnce(String refreshToken) {
        try {
            return identityProvider.refresh(refreshToken);
        } catch (IdentityProviderUnavailableException e) {
            throw new AuthenticationException("Session refresh failed: identity provider unavailable", e);
        } catch (AuthenticationException e) {
            throw new AuthenticationException("Session refresh failed: " + e.getMessage(), e);
        }
    }

    private Map<String, String> stringify(Map<String, Object> claims) {
        Map<String, String> raw = new LinkedHashMap<>();
        if (claims == null) return raw;
        claims.forEach((key, value) -> {
            if (key == null || value == null) return;
            if (value instanceof String text) {
                raw.put(key, text);
            } else {
                try {
                    raw.put(key, objectMapper.writeValueAsString(value));
                } catch (JsonProcessingException e) {
                    raw.put(key, String.valueOf(value));
                }
            }
        });
        return raw;
    }

    private static Set<String> allowListed(Set<String> values, List<String> allowed) {
        if (allowed == null || allowed.isEmpty()) return values;
        Set<String> filtered = new LinkedHashSet<>(values);
        filtered.retainAll(allowed);
        return filtered;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
