package com.example.devopsgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * DevOps Gateway
 *
 * Fronts DevOps operations (logs, metrics, deploy, rollback) behind an HTTP and
 * MCP JSON-RPC API, gated by identity-provider sessions and role/permission
 * based access control, optionally proxied through an external audit gateway.
 *
 * Architecture:
 * - Principal Resolver → claims from the identity provider become a Principal
 * - Permission Engine → any/all checks, admin wildcard, delegated re-check
 * - Gateway Router → Direct (in-process services) or Proxied (MCP audit gateway)
 * - Router Factory → picks and memoizes one router from configuration
 * - Backends → Datadog telemetry or simulated data, simulated CI/CD
 */
@SpringBootApplication
@EnableAsync
public class DevopsGatewayApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         DevOps Gateway v0.1.0                    ║
            ║         RBAC + Audit Gateway Routing             ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(DevopsGatewayApplication.class, args);
    }
}
