package com.example.devopsgateway.security;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.IdentityProviderUnavailableException;
import com.example.devopsgateway.exception.SessionExpiredException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Identity provider client speaking the provider's REST session API.
 * Credentials are sent as "Bearer {projectId}:{token}".
 */
@Slf4j
@Component
public class HttpIdentityProvider implements IdentityProvider {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private final GatewayProperties.IdentityProviderConfig config;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public HttpIdentityProvider(GatewayProperties properties, ObjectMapper objectMapper, OkHttpClient httpClient) {
        this.config = properties.getIdentityProvider();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient.newBuilder()
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public ValidatedSession validate(String sessionToken, String refreshToken) {
        log.debug("Validating session token {} (refresh token present: {})", mask(sessionToken), refreshToken != null);
        JsonNode body = post(config.getValidatePath(), sessionToken, objectMapper.createObjectNode());
        return toSession(body, sessionToken);
    }

    @Override
    public ValidatedSession refresh(String refreshToken) {
        log.info("Refreshing expired session");
        JsonNode body = post(config.getRefreshPath(), refreshToken, objectMapper.createObjectNode());
        String newToken = body.path("sessionJwt").asText(null);
        return toSession(body, newToken);
    }

    @Override
    public boolean logout(String refreshToken) {
        post(config.getLogoutPath(), refreshToken, objectMapper.createObjectNode());
        log.info("Session logged out at identity provider");
        return true;
    }

    @Override
    public DelegatedCheckResult delegatedCheck(Map<String, String> claims, Set<String> required,
                                               CheckKind kind, PermissionMode mode) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("claims", objectMapper.valueToTree(claims));
        payload.set("required", objectMapper.valueToTree(required));
        payload.put("kind", kind.name().toLowerCase(Locale.ROOT));
        payload.put("mode", mode.name().toLowerCase(Locale.ROOT));

        JsonNode body = post(config.getAuthorizePath(), config.getManagementKey(), payload);
        Set<String> matched = new LinkedHashSet<>();
        body.path("matched").forEach(node -> matched.add(node.asText()));
        boolean valid = body.path("valid").asBoolean(false);
        log.debug("Delegated {} check for {} -> {} (matched {})", kind, required, valid, matched);
        return new DelegatedCheckResult(valid, matched);
    }

    private JsonNode post(String path, String credential, JsonNode payload) {
        if (!isConfigured()) {
            throw new AuthenticationException("Identity provider not configured");
        }
        try {
            Request request = new Request.Builder()
                    .url(config.getBaseUrl().replaceAll("/+$", "") + path)
                    .addHeader("Authorization", "Bearer " + config.getProjectId() + ":" + credential)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (response.isSuccessful()) {
                    return responseBody.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(responseBody);
                }
                throw toException(response.code(), responseBody);
            }
        } catch (IOException e) {
            log.warn("Identity provider call to {} failed: {}", path, e.getMessage());
            throw new IdentityProviderUnavailableException("Identity provider unreachable: " + e.getMessage(), e);
        }
    }

    private RuntimeException toException(int code, String responseBody) {
        String description = describe(responseBody);
        if (code >= 500) {
            log.warn("Identity provider error {}: {}", code, description);
            return new IdentityProviderUnavailableException("Identity provider error " + code + ": " + description);
        }
        if (code == 401 && description.toLowerCase(Locale.ROOT).contains("expired")) {
            return new SessionExpiredException("Session expired: " + description);
        }
        return new AuthenticationException("Session validation error: " + description);
    }

    private String describe(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) return "no details";
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            for (String field : new String[]{"errorDescription", "message", "error"}) {
                if (node.hasNonNull(field)) return node.get(field).asText();
            }
        } catch (IOException e) {
            log.debug("Identity provider error body is not JSON: {}", e.getMessage());
        }
        return responseBody.length() > 200 ? responseBody.substring(0, 200) : responseBody;
    }

    private ValidatedSession toSession(JsonNode body, String sessionToken) {
        JsonNode claimsNode = body;
        if (body.path("claims").isObject()) {
            claimsNode = body.get("claims");
        } else if (body.path("token").isObject()) {
            claimsNode = body.get("token");
        }
        Map<String, Object> claims = objectMapper.convertValue(claimsNode, CLAIMS_TYPE);
        return new ValidatedSession(claims, sessionToken);
    }

    static String mask(String token) {
        if (token == null) return "null";
        if (token.length() <= 12) return "***";
        return token.substring(0, 6) + "..." + token.substring(token.length() - 4);
    }
}
