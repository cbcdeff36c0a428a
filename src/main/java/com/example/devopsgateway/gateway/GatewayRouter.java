package com.example.devopsgateway.gateway;

import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.MetricsResult;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.security.Principal;

/**
 * Transport-independent contract for the DevOps operations.
 *
 * Every read and write checks the principal's permissions before doing any
 * work, so a denied call never reaches a backend or the proxied gateway.
 * Deploy and rollback pick the required permission from {@code environment};
 * an unknown environment fails validation before the permission check.
 */
public interface GatewayRouter {

    LogsResult getLogs(RequestContext ctx, Principal principal, String level, int limit, String since);

    MetricsResult getMetrics(RequestContext ctx, Principal principal, int limit, String service);

    DeployResult deploy(RequestContext ctx, Principal principal, String serviceName, String version,
                        String environment);

    RollbackResult rollback(RequestContext ctx, Principal principal, String deploymentId, String reason,
                            String environment);

    /**
     * Validate a session token and resolve its principal. No anonymous fallback.
     */
    Principal authenticate(RequestContext ctx, String sessionToken, String refreshToken);

    /**
     * "direct" or "proxied".
     */
    String getType();
}
