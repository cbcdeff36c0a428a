package com.example.devopsgateway.gateway;

import com.example.devopsgateway.exception.GatewayException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads JSON-RPC responses from the gateway. Bodies arrive either as one JSON
 * object or as an event stream of {@code data: {json}} lines; in both cases
 * the first envelope carrying a result or an error decides the outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpResponseParser {

    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper objectMapper;

    /**
     * @return the {@code result} member of the response envelope
     * @throws GatewayException when the envelope carries an error or cannot be read
     */
    public JsonNode parseResult(String body, String contentType) {
        if (body == null || body.isBlank()) {
            throw new GatewayException("Empty response from gateway");
        }
        boolean eventStream = (contentType != null && contentType.startsWith("text/event-stream"))
                || body.stripLeading().startsWith(DATA_PREFIX);
        return eventStream ? parseEventStream(body) : unwrap(readJson(body));
    }

    /**
     * Tool payload inside a {@code tools/call} result: structured content when
     * present, otherwise the JSON text of the first content block, otherwise
     * the result itself.
     */
    public JsonNode toolPayload(JsonNode result) {
        if (result.path("isError").asBoolean(false)) {
            String text = result.path("content").path(0).path("text").asText("tool reported an error");
            throw new GatewayException("Gateway tool error: " + text);
        }
        JsonNode structured = result.get("structuredContent");
        if (structured != null && structured.isObject()) {
            return structured;
        }
        JsonNode first = result.path("content").path(0);
        if (first.path("type").asText("text").equals("text") && first.hasNonNull("text")) {
            try {
                return objectMapper.readTree(first.get("text").asText());
            } catch (JsonProcessingException e) {
                throw new GatewayException("Gateway tool returned non-JSON content", e);
            }
        }
        return result;
    }

    private JsonNode parseEventStream(String body) {
        for (String line : body.split("\\r?\\n")) {
            if (!line.startsWith(DATA_PREFIX)) continue;
            String payload = line.substring(DATA_PREFIX.length()).trim();
            if (payload.isEmpty()) continue;
            JsonNode envelope = readJson(payload);
            if (envelope.has("result") || envelope.has("error")) {
                return unwrap(envelope);
            }
        }
        throw new GatewayException("No valid data found in event stream response");
    }

    private JsonNode unwrap(JsonNode envelope) {
        if (envelope.has("result")) {
            return envelope.get("result");
        }
        if (envelope.has("error")) {
            String message = envelope.get("error").path("message").asText("unknown error");
            log.warn("Gateway returned RPC error: {}", envelope.get("error"));
            throw new GatewayException("Gateway returned error: " + message);
        }
        throw new GatewayException("Unexpected response format from gateway");
    }

    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable gateway response: {}", text.length() > 500 ? text.substring(0, 500) : text);
            throw new GatewayException("Invalid response from gateway", e);
        }
    }
}
