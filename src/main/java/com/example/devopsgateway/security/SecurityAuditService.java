package com.example.devopsgateway.security;

import com.example.devopsgateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Audits the gateway's security-relevant configuration.
 *
 * Checks run at startup and on demand:
 * - anonymous access and the privileges of its role
 * - wildcard grants held by non-admin roles
 * - identity provider and delegated-check credentials
 * - proxied gateway transport settings
 * - telemetry backend credentials
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityAuditService {

    private static final Set<String> WRITE_PERMISSIONS = Set.of(
            OperationPermissions.DEPLOY_STAGING, OperationPermissions.DEPLOY_PRODUCTION,
            OperationPermissions.ROLLBACK_STAGING, OperationPermissions.ROLLBACK_PRODUCTION);

    private final GatewayProperties properties;
    private final PolicyTable policyTable;

    private final List<AuditFinding> findings = Collections.synchronizedList(new ArrayList<>());

    @EventListener(ApplicationReadyEvent.class)
    public void auditOnStartup() {
        List<AuditFinding> result = runAudit();
        result.stream()
                .filter(f -> f.severity() == AuditSeverity.CRITICAL)
                .forEach(f -> log.warn("Security finding [{}]: {}", f.category(), f.message()));
    }

    /**
     * Run a full security audit.
     */
    public List<AuditFinding> runAudit() {
        if (!properties.getSecurity().isAuditEnabled()) return List.of();

        findings.clear();
        log.info("Running security configuration audit...");

        checkAnonymousAccess();
        checkWildcardGrants();
        checkPolicyTable();
        checkIdentityProvider();
        checkProxy();
        checkTelemetry();

        long criticalCount = findings.stream().filter(f -> f.severity() == AuditSeverity.CRITICAL).count();
        long warnCount = findings.stream().filter(f -> f.severity() == AuditSeverity.WARN).count();
        log.info("Security audit complete: {} findings ({} critical, {} warnings)",
                findings.size(), criticalCount, warnCount);

        return List.copyOf(findings);
    }

    private void checkAnonymousAccess() {
        var auth = properties.getAuth();
        if (!auth.isAnonymousEnabled()) return;

        findings.add(new AuditFinding(
                AuditSeverity.INFO,
                "auth.anonymous_enabled",
                "Anonymous access is enabled with role '" + auth.getAnonymousRole() + "'.",
                "Set devops-gateway.auth.anonymous-enabled=false outside development."
        ));

        Set<String> granted = policyTable.permissionsFor(auth.getAnonymousRole());
        boolean canWrite = granted.stream()
                .anyMatch(p -> WRITE_PERMISSIONS.contains(p) || OperationPermissions.isWildcard(p));
        if (canWrite) {
            findings.add(new AuditFinding(
                    AuditSeverity.CRITICAL,
                    "auth.anonymous_write",
                    "Anonymous role '" + auth.getAnonymousRole() + "' grants write permissions: " + granted,
                    "Map the anonymous role to read-only permissions."
            ));
        }
    }

    private void checkWildcardGrants() {
        List<String> adminRoles = properties.getSecurity().getAdminRoles();
        for (String role : policyTable.wildcardRoles()) {
            boolean admin = adminRoles.stream().anyMatch(a -> a.equalsIgnoreCase(role));
            if (!admin) {
                findings.add(new AuditFinding(
                        AuditSeverity.WARN,
                        "policy.wildcard_grant",
                        "Role '" + role + "' holds a wildcard permission. This grants unrestricted access.",
                        "Restrict the permissions of '" + role + "' or list it in devops-gateway.security.admin-roles."
                ));
            }
        }
    }

    private void checkPolicyTable() {
        if (policyTable.roleNames().isEmpty()) {
            findings.add(new AuditFinding(
                    AuditSeverity.WARN,
                    "policy.empty",
                    "Policy table is empty. Principals carrying only roles receive no permissions.",
                    "Configure devops-gateway.policy.roles."
            ));
        }
    }

    private void checkIdentityProvider() {
        var idp = properties.getIdentityProvider();
        if (!idp.isConfigured()) {
            findings.add(new AuditFinding(
                    AuditSeverity.INFO,
                    "config.identity_provider",
                    "Identity provider is not configured. Only anonymous access is possible.",
                    "Set devops-gateway.identity-provider.base-url and project-id."
            ));
            return;
        }
        if (idp.getBaseUrl().startsWith("http://")) {
            findings.add(new AuditFinding(
                    AuditSeverity.WARN,
                    "config.identity_provider_tls",
                    "Identity provider is reached over plain HTTP.",
                    "Use an https:// base URL."
            ));
        }
        if (idp.getManagementKey() == null || idp.getManagementKey().isBlank()) {
            findings.add(new AuditFinding(
                    AuditSeverity.INFO,
                    "config.delegated_checks",
                    "No management key configured; delegated permission checks will be denied.",
                    "Set devops-gateway.identity-provider.management-key."
            ));
        }
    }

    private void checkProxy() {
        var proxy = properties.getProxy();
        if (proxy.isEnabled() && !proxy.isActive()) {
            findings.add(new AuditFinding(
                    AuditSeverity.WARN,
                    "config.proxy_url",
                    "Proxied gateway is enabled but no URL is configured. Requests are served directly.",
                    "Set devops-gateway.proxy.url or disable the proxy."
            ));
        }
        if (proxy.isActive() && proxy.getUrl().startsWith("http://")) {
            findings.add(new AuditFinding(
                    AuditSeverity.WARN,
                    "config.proxy_tls",
                    "Session credentials are forwarded to the proxied gateway over plain HTTP.",
                    "Use an https:// gateway URL."
            ));
        }
    }

    private void checkTelemetry() {
        if (!properties.getTelemetry().getDatadog().isConfigured()) {
            findings.add(new AuditFinding(
                    AuditSeverity.INFO,
                    "config.telemetry_keys",
                    "Datadog API/application keys are not configured. Logs and metrics are simulated.",
                    "Set devops-gateway.telemetry.datadog.api-key and app-key."
            ));
        }
    }

    /**
     * Get latest audit findings.
     */
    public List<AuditFinding> getFindings() {
        return List.copyOf(findings);
    }

    public enum AuditSeverity {
        CRITICAL, WARN, INFO
    }

    public record AuditFinding(
            AuditSeverity severity,
            String category,
            String message,
            String remediation
    ) {
        public Map<String, String> toMap() {
            return Map.of(
                    "severity", severity.name(),
                    "category", category,
                    "message", message,
                    "remediation", remediation,
                    "timestamp", Instant.now().toString()
            );
        }
    }
}
