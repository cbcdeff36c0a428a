package com.example.devopsgateway.backend;

import com.example.devopsgateway.config.GatewayProperties;
import org.springframework.http.HttpHeaders;

import java.util.function.Consumer;

/**
 * Shared Datadog endpoint and credential handling.
 */
final class DatadogSupport {

    static final String API_KEY_HEADER = "DD-API-KEY";
    static final String APP_KEY_HEADER = "DD-APPLICATION-KEY";

    private DatadogSupport() {
    }

    static String baseUrl(GatewayProperties.TelemetryConfig.DatadogConfig config) {
        String site = config.getSite();
        if (site.startsWith("http://") || site.startsWith("https://")) {
            return site.endsWith("/") ? site.substring(0, site.length() - 1) : site;
        }
        return "https://" + site;
    }

    static Consumer<HttpHeaders> credentials(GatewayProperties.TelemetryConfig.DatadogConfig config) {
        return headers -> {
            headers.set(API_KEY_HEADER, config.getApiKey());
            if (config.getAppKey() != null && !config.getAppKey().isBlank()) {
                headers.set(APP_KEY_HEADER, config.getAppKey());
            }
        };
    }
}
