package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.exception.GatewayException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * MCP over streamable HTTP to the external audit gateway.
 *
 * Handshake: {@code initialize} → read the {@code Mcp-Session-Id} header → READY
 * → one-way {@code notifications/initialized}. The transition is serialized by
 * a lock so concurrent cold-start callers share one handshake. A failed
 * handshake returns the state to UNINITIALIZED and the next call retries it.
 */
@Slf4j
@Component
public class McpGatewayTransport implements GatewayTransport {

    public static final String SESSION_HEADER = "Mcp-Session-Id";
    public static final String PROTOCOL_HEADER = "MCP-Protocol-Version";
    static final String ACCEPT = "application/json, text/event-stream";
    private static final MediaType JSON_MEDIA = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final McpResponseParser responseParser;
    private final GatewayProperties.ProxyConfig config;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock handshakeLock = new ReentrantLock();
    private final AtomicInteger handshakes = new AtomicInteger();
    private volatile GatewaySessionState state = GatewaySessionState.UNINITIALIZED;
    private volatile String sessionId;

    public McpGatewayTransport(OkHttpClient httpClient, ObjectMapper objectMapper, McpResponseParser responseParser,
                               GatewayProperties properties, MeterRegistry meterRegistry) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.responseParser = responseParser;
        this.config = properties.getProxy();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public JsonNode callTool(RequestContext ctx, String toolName, Map<String, Object> arguments) {
        ensureInitialized();

        JsonRpcMessage envelope = JsonRpcMessage.request(UUID.randomUUID().toString(), "tools/call",
                Map.of("name", toolName, "arguments", arguments));
        Request.Builder request = envelopeRequest(envelope);
        if (ctx != null) {
            if (ctx.getAuthorization() != null) request.header(HttpHeaders.AUTHORIZATION, ctx.getAuthorization());
            if (ctx.getCookie() != null) request.header(HttpHeaders.COOKIE, ctx.getCookie());
        }

        log.info("Forwarding tools/call {} through the audit gateway", toolName);
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new GatewayException("Gateway error: " + response.code());
            }
            String body = response.body() != null ? response.body().string() : "";
            JsonNode result = responseParser.parseResult(body, response.header(HttpHeaders.CONTENT_TYPE));
            outcome = "success";
            return responseParser.toolPayload(result);
        } catch (IOException e) {
            throw new GatewayException("Gateway request failed: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("devops.gateway.proxy.duration", "tool", toolName, "outcome", outcome));
        }
    }

    void ensureInitialized() {
        if (state == GatewaySessionState.READY) return;

        handshakeLock.lock();
        try {
            if (state == GatewaySessionState.READY) return;
            state = GatewaySessionState.INITIALIZING;
            try {
                initialize();
            } catch (RuntimeException e) {
                state = GatewaySessionState.UNINITIALIZED;
                sessionId = null;
                throw e;
            }
        } finally {
            handshakeLock.unlock();
        }
        sendInitializedNotification();
    }

    private void initialize() {
        log.info("Initializing audit gateway session at {}", config.getUrl());
        Map<String, Object> params = Map.of(
                "protocolVersion", config.getProtocolVersion(),
                "capabilities", Map.of(
                        "resources", Map.of("subscribe", true, "listChanged", true),
                        "tools", Map.of("listChanged", true)),
                "clientInfo", Map.of("name", config.getClientName(), "version", config.getClientVersion()));
        JsonRpcMessage envelope = JsonRpcMessage.request(UUID.randomUUID().toString(), "initialize", params);

        try (Response response = httpClient.newCall(envelopeRequest(envelope).build()).execute()) {
            if (response.code() != 200) {
                log.warn("Audit gateway initialization failed: HTTP {}", response.code());
                throw new GatewayException("Gateway initialization failed: " + response.code());
            }
            sessionId = response.header(SESSION_HEADER);
            if (sessionId == null) {
                log.warn("Audit gateway did not assign a session id; continuing without one");
            }
            state = GatewaySessionState.READY;
            handshakes.incrementAndGet();
            meterRegistry.counter("devops.gateway.handshakes").increment();
            log.info("Audit gateway session ready (session id present: {})", sessionId != null);
        } catch (IOException e) {
            log.error("Failed to reach audit gateway for initialization: {}", e.getMessage());
            throw new GatewayException("Gateway initialization failed: " + e.getMessage(), e);
        }
    }

    private void sendInitializedNotification() {
        if (sessionId == null) return;
        JsonRpcMessage notification = JsonRpcMessage.notification("notifications/initialized", null);
        try (Response response = httpClient.newCall(envelopeRequest(notification).build()).execute()) {
            if (response.code() == 202) {
                log.debug("Initialized notification accepted");
            } else {
                log.warn("Initialized notification returned HTTP {}", response.code());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Initialized notification failed: {}", e.getMessage());
        }
    }

    private Request.Builder envelopeRequest(JsonRpcMessage envelope) {
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to serialize gateway request", e);
        }
        Request.Builder builder;
        try {
            builder = new Request.Builder().url(config.getUrl());
        } catch (IllegalArgumentException e) {
            throw new GatewayException("Invalid gateway URL: " + config.getUrl(), e);
        }
        builder.header(HttpHeaders.ACCEPT, ACCEPT)
                .header(PROTOCOL_HEADER, config.getProtocolVersion())
                .header(HttpHeaders.USER_AGENT, config.getClientName() + "/" + config.getClientVersion())
                .post(RequestBody.create(json, JSON_MEDIA));
        String current = sessionId;
        if (current != null) {
            builder.header(SESSION_HEADER, current);
        }
        return builder;
    }

    @Override
    public GatewaySessionState getState() {
        return state;
    }

    @Override
    public Optional<String> getSessionId() {
        return Optional.ofNullable(sessionId);
    }

    @Override
    public int getHandshakeCount() {
        return handshakes.get();
    }
}
