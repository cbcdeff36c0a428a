package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.MetricSample;
import com.example.devopsgateway.domain.MetricsResult;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.GatewayApiException;
import com.example.devopsgateway.exception.GatewayException;
import com.example.devopsgateway.security.ClaimRules;
import com.example.devopsgateway.security.Environment;
import com.example.devopsgateway.security.OperationPermissions;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.PrincipalResolver;
import com.example.devopsgateway.service.AuditService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Routes operations through the external audit gateway.
 *
 * Writes (deploy, rollback, authenticate) are synchronous; a {@link GatewayException}
 * is answered by running the same call once on the direct router, so callers see
 * the same result shape whichever path served them.
 *
 * Reads depend on {@code proxy.read-mode}:
 * - OPTIMISTIC: a placeholder flagged {@code loading} is returned at once and the
 *   real call runs on the gateway executor with a timeout; its outcome is kept in
 *   the {@link PendingResultStore} under the placeholder's {@code request_id}.
 * - SYNCHRONOUS: the real call is awaited with the same timeout and falls back to
 *   the direct router on failure.
 */
@Slf4j
@Component
@Lazy
public class ProxiedGatewayRouter extends AbstractGatewayRouter {

    public static final String TYPE = "proxied";

    static final String LOGS_TOOL = "getMcpResourcesLogs";
    static final String METRICS_TOOL = "getMcpResourcesMetrics";
    static final String DEPLOY_TOOL = "postMcpToolsDeployService";
    static final String ROLLBACK_TOOL = "postMcpToolsRollbackDeployment";
    static final String AUTHENTICATE_TOOL = "authenticate_user";

    private final GatewayTransport transport;
    private final GatewayRouter fallback;
    private final PlaceholderDataGenerator placeholders;
    private final PendingResultStore resultStore;
    private final Executor executor;
    private final GatewayProperties.ProxyConfig config;
    private final ObjectMapper objectMapper;
    private final PrincipalResolver principalResolver;

    public ProxiedGatewayRouter(PermissionEngine permissionEngine, AuditService auditService, MeterRegistry meterRegistry,
                                GatewayTransport transport,
                                @Qualifier("directGatewayRouter") GatewayRouter fallback,
                                PlaceholderDataGenerator placeholders, PendingResultStore resultStore,
                                @Qualifier("gatewayExecutor") Executor executor,
                                GatewayProperties properties, ObjectMapper objectMapper,
                                PrincipalResolver principalResolver) {
        super(permissionEngine, auditService, meterRegistry);
        this.transport = transport;
        this.fallback = fallback;
        this.placeholders = placeholders;
        this.resultStore = resultStore;
        this.executor = executor;
        this.config = properties.getProxy();
        this.objectMapper = objectMapper;
        this.principalResolver = principalResolver;
    }

    // ── Reads ──

    @Override
    public LogsResult getLogs(RequestContext ctx, Principal principal, String level, int limit, String since) {
        log.info("Routing logs request through the audit gateway");
        checkPermission(principal, OperationPermissions.READ_LOGS, "read logs");
        String normalizedLevel = normalizeLevel(level);
        validateLimit(limit);
        parseSince(since, Instant.now());

        Map<String, Object> arguments = new LinkedHashMap<>();
        if (normalizedLevel != null) arguments.put("level", normalizedLevel);
        arguments.put("limit", limit);
        if (since != null && !since.isBlank()) arguments.put("since", since);
        Supplier<LogsResult> call = () -> convert(transport.callTool(ctx, LOGS_TOOL, arguments), LogsResult.class);

        if (config.getReadMode() == GatewayProperties.ReadMode.SYNCHRONOUS) {
            return awaitRead("get_logs", "GET_LOGS", "logs", ctx, principal, call,
                    () -> fallback.getLogs(ctx, principal, level, limit, since));
        }

        String requestId = RequestContext.newRequestId();
        List<LogEntry> placeholder = placeholders.logs(limit, normalizedLevel);
        startBackgroundRead(requestId, "get_logs", principal, call);

        recordCall("get_logs", Route.OPTIMISTIC);
        audit(ctx, principal, "GET_LOGS", "logs", Route.OPTIMISTIC,
                Map.of("placeholder", placeholder.size(), "result_id", requestId), true);
        return LogsResult.builder()
                .count(placeholder.size())
                .filters(DirectGatewayRouter.logFilters(normalizedLevel, limit, since))
                .data(placeholder)
                .loading(true)
                .message(PlaceholderDataGenerator.LOADING_MESSAGE)
                .requestId(requestId)
                .build();
    }

    @Override
    public MetricsResult getMetrics(RequestContext ctx, Principal principal, int limit, String service) {
        log.info("Routing metrics request through the audit gateway");
        checkPermission(principal, OperationPermissions.READ_METRICS, "read metrics");
        validateLimit(limit);
        String serviceFilter = service == null || service.isBlank() ? null : service.trim();

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("limit", limit);
        if (serviceFilter != null) arguments.put("service", serviceFilter);
        Supplier<MetricsResult> call = () -> convert(transport.callTool(ctx, METRICS_TOOL, arguments), MetricsResult.class);

        String target = serviceFilter != null ? serviceFilter : "metrics";
        if (config.getReadMode() == GatewayProperties.ReadMode.SYNCHRONOUS) {
            return awaitRead("get_metrics", "GET_METRICS", target, ctx, principal, call,
                    () -> fallback.getMetrics(ctx, principal, limit, service));
        }

        String requestId = RequestContext.newRequestId();
        List<MetricSample> placeholder = placeholders.metrics(limit, serviceFilter);
        startBackgroundRead(requestId, "get_metrics", principal, call);

        recordCall("get_metrics", Route.OPTIMISTIC);
        audit(ctx, principal, "GET_METRICS", target, Route.OPTIMISTIC,
                Map.of("placeholder", placeholder.size(), "result_id", requestId), true);
        return MetricsResult.builder()
                .count(placeholder.size())
                .filters(DirectGatewayRouter.metricFilters(limit, serviceFilter))
                .data(placeholder)
                .loading(true)
                .message(PlaceholderDataGenerator.LOADING_MESSAGE)
                .requestId(requestId)
                .build();
    }

    // ── Writes ──

    @Override
    public DeployResult deploy(RequestContext ctx, Principal principal, String serviceName, String version,
                               String environment) {
        log.info("Routing deploy request through the audit gateway");
        Environment env = checkEnvironmentPermission(principal, OperationPermissions.WriteOperation.DEPLOY, environment);
        String service = requireText(serviceName, "service_name");
        String ver = requireText(version, "version");

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("service_name", service);
        arguments.put("version", ver);
        arguments.put("environment", env.value());

        try {
            DeployResult result = convert(transport.callTool(ctx, DEPLOY_TOOL, arguments), DeployResult.class);
            if (result.getStatus() == null) {
                throw new GatewayException("Gateway returned a deploy result without status");
            }
            if (result.getEnvironment() == null) result.setEnvironment(env.value());
            recordCall("deploy_service", Route.PROXIED);
            audit(ctx, principal, "DEPLOY", service, Route.PROXIED,
                    Map.of("version", ver, "environment", env.value(), "status", result.getStatus().name()),
                    result.isSuccess());
            return result;
        } catch (GatewayException e) {
            return fallBack("deploy_service", "DEPLOY", service, ctx, principal, e,
                    () -> fallback.deploy(ctx, principal, serviceName, version, environment));
        }
    }

    @Override
    public RollbackResult rollback(RequestContext ctx, Principal principal, String deploymentId, String reason,
                                   String environment) {
        log.info("Routing rollback request through the audit gateway");
        Environment env = checkEnvironmentPermission(principal, OperationPermissions.WriteOperation.ROLLBACK, environment);
        String deployment = requireText(deploymentId, "deployment_id");
        String trimmedReason = requireReason(reason);

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("deployment_id", deployment);
        arguments.put("reason", trimmedReason);
        arguments.put("environment", env.value());

        try {
            RollbackResult result = convert(transport.callTool(ctx, ROLLBACK_TOOL, arguments), RollbackResult.class);
            if (result.getStatus() == null) {
                throw new GatewayException("Gateway returned a rollback result without status");
            }
            if (result.getEnvironment() == null) result.setEnvironment(env.value());
            recordCall("rollback_deployment", Route.PROXIED);
            audit(ctx, principal, "ROLLBACK", deployment, Route.PROXIED,
                    Map.of("environment", env.value(), "status", result.getStatus().name()), result.isSuccess());
            return result;
        } catch (GatewayException e) {
            return fallBack("rollback_deployment", "ROLLBACK", deployment, ctx, principal, e,
                    () -> fallback.rollback(ctx, principal, deploymentId, reason, environment));
        }
    }

    @Override
    public Principal authenticate(RequestContext ctx, String sessionToken, String refreshToken) {
        log.info("Routing authenticate request through the audit gateway");
        String token = requireText(sessionToken, "session_token");

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("session_token", token);
        if (refreshToken != null) arguments.put("refresh_token", refreshToken);

        try {
            Principal principal = toPrincipal(transport.callTool(ctx, AUTHENTICATE_TOOL, arguments), token, refreshToken);
            recordCall("authenticate_user", Route.PROXIED);
            audit(ctx, principal, "AUTHENTICATE", principal.getUserId(), Route.PROXIED, null, true);
            return principal;
        } catch (GatewayException e) {
            return fallBack("authenticate_user", "AUTHENTICATE", null, ctx, null, e,
                    () -> fallback.authenticate(ctx, sessionToken, refreshToken));
        }
    }

    @Override
    public String getType() {
        return TYPE;
    }

    // ── Internals ──

    private <T> T fallBack(String operation, String action, String target, RequestContext ctx, Principal principal,
                           GatewayException cause, Supplier<T> direct) {
        log.warn("Audit gateway call {} failed ({}), falling back to direct mode", operation, cause.getMessage());
        meterRegistry.counter("devops.gateway.fallbacks", "operation", operation).increment();
        recordCall(operation, Route.FALLBACK);
        if (principal != null) {
            audit(ctx, principal, action, target, Route.FALLBACK, Map.of("error", String.valueOf(cause.getMessage())), false);
        }
        return direct.get();
    }

    private <T> T awaitRead(String operation, String action, String target, RequestContext ctx, Principal principal,
                            Supplier<T> call, Supplier<T> direct) {
        try {
            T result = CompletableFuture.supplyAsync(call, executor)
                    .orTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                    .join();
            recordCall(operation, Route.PROXIED);
            audit(ctx, principal, action, target, Route.PROXIED, null, true);
            return result;
        } catch (CompletionException | RejectedExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof GatewayApiException apiError && !(cause instanceof GatewayException)) {
                throw apiError;
            }
            GatewayException gatewayError = cause instanceof GatewayException ge
                    ? ge
                    : new GatewayException(describe(cause), cause);
            return fallBack(operation, action, target, ctx, principal, gatewayError, direct);
        }
    }

    private <T> void startBackgroundRead(String requestId, String operation, Principal principal, Supplier<T> call) {
        resultStore.begin(requestId, operation, principal != null ? principal.getUserId() : null);
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor)
                    .orTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Background {} for request {} rejected: executor saturated", operation, requestId);
            resultStore.fail(requestId, "Background executor saturated");
            meterRegistry.counter("devops.gateway.background", "outcome", "rejected").increment();
            return;
        }

        future.whenComplete((result, error) -> {
            if (error == null) {
                resultStore.complete(requestId, result);
                meterRegistry.counter("devops.gateway.background", "outcome", "completed").increment();
                log.info("Background {} for request {} completed", operation, requestId);
            } else {
                Throwable cause = unwrap(error);
                String outcome = cause instanceof TimeoutException ? "timeout" : "failed";
                resultStore.fail(requestId, describe(cause));
                meterRegistry.counter("devops.gateway.background", "outcome", outcome).increment();
                log.warn("Background {} for request {} {}: {}", operation, requestId, outcome, describe(cause));
            }
        });
    }

    private <T> T convert(JsonNode payload, Class<T> type) {
        try {
            return objectMapper.treeToValue(unwrapToolResult(payload), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GatewayException("Unexpected " + type.getSimpleName() + " payload from gateway", e);
        }
    }

    /**
     * Tools that answer {@code {tool, success, result}} carry the payload in {@code result}.
     */
    private JsonNode unwrapToolResult(JsonNode payload) {
        if (payload.has("tool") && payload.path("result").isObject()) {
            return payload.get("result");
        }
        return payload;
    }

    private Principal toPrincipal(JsonNode payload, String sessionToken, String refreshToken) {
        if (payload.has("success") && !payload.path("success").asBoolean()) {
            throw new AuthenticationException(payload.path("error").asText("Authentication failed"));
        }
        Map<String, Object> claims = objectMapper.convertValue(unwrapToolResult(payload),
                objectMapper.getTypeFactory().constructMapType(Map.class, String.class, Object.class));
        if (ClaimRules.firstString(claims, ClaimRules.USER_ID).isEmpty()) {
            throw new GatewayException("Gateway returned a principal without user_id");
        }
        return principalResolver.fromClaims(claims, sessionToken, refreshToken);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Gateway call timed out after " + config.getReadTimeoutSeconds() + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
