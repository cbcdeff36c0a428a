package com.example.devopsgateway.gateway;

import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.PermissionDeniedException;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.Environment;
import com.example.devopsgateway.security.OperationPermissions;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.PermissionMode;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permission checks, argument validation and bookkeeping shared by both routers.
 */
@Slf4j
public abstract class AbstractGatewayRouter implements GatewayRouter {

    static final int MAX_LIMIT = 1000;
    static final int MIN_REASON_LENGTH = 5;
    static final Set<String> LEVELS = Set.of("DEBUG", "INFO", "WARN", "ERROR");
    private static final Pattern RELATIVE_SINCE = Pattern.compile("(\\d+)([smhd])");

    protected final PermissionEngine permissionEngine;
    protected final AuditService auditService;
    protected final MeterRegistry meterRegistry;

    protected AbstractGatewayRouter(PermissionEngine permissionEngine, AuditService auditService,
                                    MeterRegistry meterRegistry) {
        this.permissionEngine = permissionEngine;
        this.auditService = auditService;
        this.meterRegistry = meterRegistry;
    }

    protected void checkPermission(Principal principal, String permission, String action) {
        if (!permissionEngine.authorize(principal, Set.of(permission), PermissionMode.ANY)) {
            log.warn("[{}] {} denied for {}: missing '{}'", getType(), action,
                    principal != null ? principal.getUserId() : "unknown", permission);
            throw new PermissionDeniedException("Permission denied: '" + permission + "' is required to " + action);
        }
    }

    /**
     * Parse the environment first so an unknown value is a 400, then check the
     * environment-specific permission.
     */
    protected Environment checkEnvironmentPermission(Principal principal, OperationPermissions.WriteOperation operation,
                                                     String environment) {
        Environment env = Environment.parse(environment);
        String permission = OperationPermissions.forEnvironment(operation, env);
        checkPermission(principal, permission, operation.name().toLowerCase(Locale.ROOT) + " in " + env.value());
        return env;
    }

    protected void recordCall(String operation, Route route) {
        meterRegistry.counter("devops.gateway.calls", "operation", operation, "route", route.name()).increment();
    }

    protected void audit(RequestContext ctx, Principal principal, String action, String target, Route route,
                         Map<String, Object> details, boolean success) {
        auditService.record(principal != null ? principal.getUserId() : "unknown", action, target, route,
                details, ctx != null ? ctx.getRequestId() : null, success);
    }

    /**
     * Uppercased level, WARNING folded into WARN; null or blank means no filter.
     */
    static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) return null;
        String upper = level.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("WARNING")) upper = "WARN";
        if (!LEVELS.contains(upper)) {
            throw new ValidationException("Invalid level '" + level + "'. Must be one of DEBUG, INFO, WARN, ERROR");
        }
        return upper;
    }

    static void validateLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
        return value.trim();
    }

    static String requireReason(String reason) {
        if (reason == null || reason.trim().length() < MIN_REASON_LENGTH) {
            throw new ValidationException("Rollback reason must be at least " + MIN_REASON_LENGTH + " characters");
        }
        return reason.trim();
    }

    /**
     * An ISO-8601 instant or a relative window such as 30m, 6h or 7d.
     */
    static Instant parseSince(String since, Instant now) {
        if (since == null || since.isBlank()) return null;
        String value = since.trim();
        Matcher relative = RELATIVE_SINCE.matcher(value);
        if (relative.matches()) {
            long amount = Long.parseLong(relative.group(1));
            Duration window = switch (relative.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
            return now.minus(window);
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid since '" + since + "'. Use an ISO-8601 instant or a window like 30m, 6h, 7d");
        }
    }
}
