package com.example.devopsgateway.security;

/**
 * Permission names required by each gateway operation.
 */
public final class OperationPermissions {

    public static final String READ_LOGS = "read_logs";
    public static final String READ_METRICS = "read_metrics";
    public static final String DEPLOY_STAGING = "deploy_staging";
    public static final String DEPLOY_PRODUCTION = "deploy_production";
    public static final String ROLLBACK_STAGING = "rollback_staging";
    public static final String ROLLBACK_PRODUCTION = "rollback_production";
    public static final String READ_DEPLOYMENTS = "read_deployments";
    public static final String READ_ROLLBACKS = "read_rollbacks";
    public static final String READ_AUDIT = "read_audit";

    public static final String WILDCARD = "*";
    public static final String ADMIN_WILDCARD = "admin:*";

    private OperationPermissions() {
    }

    public enum WriteOperation {
        DEPLOY, ROLLBACK
    }

    /**
     * Production and staging map to disjoint permissions.
     */
    public static String forEnvironment(WriteOperation operation, Environment environment) {
        return switch (operation) {
            case DEPLOY -> environment == Environment.PRODUCTION ? DEPLOY_PRODUCTION : DEPLOY_STAGING;
            case ROLLBACK -> environment == Environment.PRODUCTION ? ROLLBACK_PRODUCTION : ROLLBACK_STAGING;
        };
    }

    public static boolean isWildcard(String permission) {
        return WILDCARD.equals(permission) || ADMIN_WILDCARD.equals(permission);
    }
}
