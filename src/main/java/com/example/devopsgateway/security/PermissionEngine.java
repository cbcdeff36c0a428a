package com.example.devopsgateway.security;

import com.example.devopsgateway.exception.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Evaluates required roles or permissions against a {@link Principal}.
 *
 * The admin wildcard short-circuits every check. When the local check fails
 * for a provider-issued principal, the identity provider is asked once to
 * re-evaluate against the original claims; an unreachable provider counts as denial.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PermissionEngine {

    private final IdentityProvider identityProvider;

    /**
     * Never throws. Callers convert {@code false} into a 403.
     */
    public boolean authorize(Principal principal, Set<String> required, PermissionMode mode) {
        if (principal == null) return false;
        if (hasWildcard(principal.getPermissions())) return true;
        if (matches(principal.getPermissions(), required, mode)) return true;
        if (required == null || required.isEmpty()) return false;
        return delegated(principal, required, CheckKind.PERMISSION, mode);
    }

    public boolean authorize(Principal principal, String permission) {
        return authorize(principal, Set.of(permission), PermissionMode.ANY);
    }

    /**
     * Same semantics as {@link #authorize} but evaluated against role names.
     */
    public boolean authorizeRoles(Principal principal, Set<String> required, PermissionMode mode) {
        if (principal == null) return false;
        if (hasWildcard(principal.getPermissions())) return true;
        if (matches(principal.getRoles(), required, mode)) return true;
        if (required == null || required.isEmpty()) return false;
        return delegated(principal, required, CheckKind.ROLE, mode);
    }

    /**
     * @throws PermissionDeniedException when {@link #authorize} fails
     */
    public void require(Principal principal, Set<String> required, PermissionMode mode) {
        if (!authorize(principal, required, mode)) {
            String who = principal != null ? principal.getUserId() : "unknown";
            log.warn("Permission denied for {}: requires {} of {}", who, mode.name().toLowerCase(), required);
            throw new PermissionDeniedException(
                    "Permission denied: requires " + (mode == PermissionMode.ALL ? "all of " : "one of ") + required);
        }
    }

    /**
     * ANY needs a non-empty intersection, so an empty requirement never matches;
     * ALL over an empty requirement is vacuously satisfied.
     */
    static boolean matches(Set<String> effective, Set<String> required, PermissionMode mode) {
        if (required == null || required.isEmpty()) return mode == PermissionMode.ALL;
        if (effective == null || effective.isEmpty()) return false;
        return switch (mode) {
            case ANY -> required.stream().anyMatch(effective::contains);
            case ALL -> effective.containsAll(required);
        };
    }

    static boolean hasWildcard(Collection<String> permissions) {
        return permissions != null && permissions.stream().anyMatch(OperationPermissions::isWildcard);
    }

    private boolean delegated(Principal principal, Set<String> required, CheckKind kind, PermissionMode mode) {
        if (!principal.isDelegationEligible() || !identityProvider.isConfigured()) {
            return false;
        }
        try {
            IdentityProvider.DelegatedCheckResult result =
                    identityProvider.delegatedCheck(principal.getRawClaims(), required, kind, mode);
            log.debug("Delegated {} check for {} on {}: {}", kind, principal.getUserId(), required, result.valid());
            return result.valid();
        } catch (Exception e) {
            log.warn("Delegated {} check failed for {}, denying: {}", kind, principal.getUserId(), e.getMessage());
            return false;
        }
    }
}
