package com.example.devopsgateway.gateway;

import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.MetricSample;
import com.example.devopsgateway.domain.MetricsResult;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.GatewayApiException;
import com.example.devopsgateway.exception.InternalException;
import com.example.devopsgateway.security.Environment;
import com.example.devopsgateway.security.OperationPermissions;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.PrincipalResolver;
import com.example.devopsgateway.service.AuditService;
import com.example.devopsgateway.service.DeployService;
import com.example.devopsgateway.service.LogService;
import com.example.devopsgateway.service.MetricsService;
import com.example.devopsgateway.service.RollbackService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Serves every operation in-process through the domain services.
 * Domain failures surface as {@link InternalException}; taxonomy errors
 * (validation, permission, authentication) pass through unchanged.
 */
@Slf4j
@Component
public class DirectGatewayRouter extends AbstractGatewayRouter {

    public static final String TYPE = "direct";

    private final LogService logService;
    private final MetricsService metricsService;
    private final DeployService deployService;
    private final RollbackService rollbackService;
    private final PrincipalResolver principalResolver;

    public DirectGatewayRouter(PermissionEngine permissionEngine, AuditService auditService, MeterRegistry meterRegistry,
                               LogService logService, MetricsService metricsService, DeployService deployService,
                               RollbackService rollbackService, PrincipalResolver principalResolver) {
        super(permissionEngine, auditService, meterRegistry);
        this.logService = logService;
        this.metricsService = metricsService;
        this.deployService = deployService;
        this.rollbackService = rollbackService;
        this.principalResolver = principalResolver;
    }

    @Override
    public LogsResult getLogs(RequestContext ctx, Principal principal, String level, int limit, String since) {
        log.info("Reading logs resource (direct mode)");
        checkPermission(principal, OperationPermissions.READ_LOGS, "read logs");
        String normalizedLevel = normalizeLevel(level);
        validateLimit(limit);
        Instant sinceInstant = parseSince(since, Instant.now());

        List<LogEntry> logs = invoke("get_logs",
                () -> logService.getRecentLogs(normalizedLevel, limit, sinceInstant));

        recordCall("get_logs", Route.DIRECT);
        audit(ctx, principal, "GET_LOGS", "logs", Route.DIRECT, null, true);
        return LogsResult.builder()
                .count(logs.size())
                .filters(logFilters(normalizedLevel, limit, since))
                .data(logs)
                .build();
    }

    @Override
    public MetricsResult getMetrics(RequestContext ctx, Principal principal, int limit, String service) {
        log.info("Reading metrics resource (direct mode)");
        checkPermission(principal, OperationPermissions.READ_METRICS, "read metrics");
        validateLimit(limit);
        String serviceFilter = service == null || service.isBlank() ? null : service.trim();

        List<MetricSample> metrics = invoke("get_metrics", () -> metricsService.getLatestMetrics(serviceFilter, limit));

        recordCall("get_metrics", Route.DIRECT);
        audit(ctx, principal, "GET_METRICS", serviceFilter != null ? serviceFilter : "metrics", Route.DIRECT, null, true);
        return MetricsResult.builder()
                .count(metrics.size())
                .filters(metricFilters(limit, serviceFilter))
                .data(metrics)
                .build();
    }

    @Override
    public DeployResult deploy(RequestContext ctx, Principal principal, String serviceName, String version,
                               String environment) {
        log.info("Deploy service (direct mode)");
        Environment env = checkEnvironmentPermission(principal, OperationPermissions.WriteOperation.DEPLOY, environment);
        String service = requireText(serviceName, "service_name");
        String ver = requireText(version, "version");

        DeployResult result = invoke("deploy_service", () -> deployService.deploy(service, ver, env.value()));

        recordCall("deploy_service", Route.DIRECT);
        audit(ctx, principal, "DEPLOY", service, Route.DIRECT,
                Map.of("version", ver, "environment", env.value(), "status", result.getStatus().name()),
                result.isSuccess());
        return result;
    }

    @Override
    public RollbackResult rollback(RequestContext ctx, Principal principal, String deploymentId, String reason,
                                   String environment) {
        log.info("Rollback deployment (direct mode)");
        Environment env = checkEnvironmentPermission(principal, OperationPermissions.WriteOperation.ROLLBACK, environment);
        String deployment = requireText(deploymentId, "deployment_id");
        String trimmedReason = requireReason(reason);

        RollbackResult result = invoke("rollback_deployment",
                () -> rollbackService.rollback(deployment, trimmedReason, env.value()));

        recordCall("rollback_deployment", Route.DIRECT);
        audit(ctx, principal, "ROLLBACK", deployment, Route.DIRECT,
                Map.of("environment", env.value(), "status", result.getStatus().name()), result.isSuccess());
        return result;
    }

    @Override
    public Principal authenticate(RequestContext ctx, String sessionToken, String refreshToken) {
        log.info("Authenticate user (direct mode)");
        Principal principal = principalResolver.resolveSession(requireText(sessionToken, "session_token"), refreshToken);
        recordCall("authenticate_user", Route.DIRECT);
        audit(ctx, principal, "AUTHENTICATE", principal.getUserId(), Route.DIRECT, null, true);
        return principal;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    private <T> T invoke(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (GatewayApiException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error executing {}: {}", operation, e.getMessage(), e);
            throw new InternalException(operation + " failed: " + e.getMessage(), e);
        }
    }

    static Map<String, Object> logFilters(String level, int limit, String since) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("level", level);
        filters.put("limit", limit);
        if (since != null && !since.isBlank()) {
            filters.put("since", since);
        }
        return filters;
    }

    static Map<String, Object> metricFilters(int limit, String service) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("limit", limit);
        if (service != null) {
            filters.put("service", service);
        }
        return filters;
    }
}
