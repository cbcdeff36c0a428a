package com.example.devopsgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the DevOps Gateway.
 * Maps to the 'devops-gateway' prefix in application.yml.
 * Blank values never fail startup: they select the fallback behaviour
 * (anonymous-only auth, direct routing, simulated telemetry).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "devops-gateway")
public class GatewayProperties {

    private AuthConfig auth = new AuthConfig();
    private IdentityProviderConfig identityProvider = new IdentityProviderConfig();
    private PolicyConfig policy = new PolicyConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();
    private SecurityConfig security = new SecurityConfig();

    @Data
    public static class AuthConfig {
        private boolean anonymousEnabled = true;
        private String anonymousRole = "Observer";
        private String sessionCookie = "DS";
        private String refreshCookie = "DSR";
    }

    @Data
    public static class IdentityProviderConfig {
        private String baseUrl = "";
        private String projectId = "";
        private String managementKey = "";
        private String validatePath = "/v1/auth/validate";
        private String refreshPath = "/v1/auth/refresh";
        private String logoutPath = "/v1/auth/logout";
        private String authorizePath = "/v1/auth/authorize";
        private int timeoutSeconds = 10;

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank()
                    && projectId != null && !projectId.isBlank();
        }
    }

    @Data
    public static class PolicyConfig {
        /** Role name → permissions granted by that role */
        private Map<String, List<String>> roles = new LinkedHashMap<>();
        /** Optional allow-list applied to role claims (empty = accept all) */
        private List<String> availableRoles = new ArrayList<>();
        /** Optional allow-list applied to permission claims (empty = accept all) */
        private List<String> availablePermissions = new ArrayList<>();
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
        private String protocolVersion = "2024-11-05";
        private String clientName = "DevOps-MCP-Server";
        private String clientVersion = "1.0.0";
        private ReadMode readMode = ReadMode.OPTIMISTIC;
        private int readTimeoutSeconds = 30;
        private int resultTtlSeconds = 300;
        private int placeholderLogCount = 15;
        private int placeholderMetricCount = 10;

        public boolean isActive() {
            return enabled && url != null && !url.isBlank();
        }
    }

    public enum ReadMode {
        OPTIMISTIC, SYNCHRONOUS
    }

    @Data
    public static class TelemetryConfig {
        private DatadogConfig datadog = new DatadogConfig();

        @Data
        public static class DatadogConfig {
            private String apiKey = "";
            private String appKey = "";
            private String site = "api.datadoghq.com";
            private String serviceName = "devops-mcp-server";
            private String logsWindow = "now-7d";

            public boolean isConfigured() {
                return apiKey != null && !apiKey.isBlank()
                        && appKey != null && !appKey.isBlank();
            }
        }
    }

    @Data
    public static class SecurityConfig {
        private boolean auditEnabled = true;
        /** Roles allowed to carry the '*' wildcard without raising a finding */
        private List<String> adminRoles = new ArrayList<>(List.of("Admin"));
    }
}
