package com.example.devopsgateway.gateway;

import com.example.devopsgateway.exception.GatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final McpResponseParser parser = new McpResponseParser(objectMapper);

    @Test
    void plainJsonResult() {
        JsonNode result = parser.parseResult("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"ok\":true}}", "application/json");

        assertThat(result.path("ok").asBoolean()).isTrue();
    }

    @Test
    void eventStreamSkipsNonDataLinesAndEmptyEvents() {
        String body = ": keep-alive\n"
                + "event: message\n"
                + "data:\n"
                + "data: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/progress\"}\n"
                + "data: {\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"count\":3}}\n\n";

        assertThat(parser.parseResult(body, "text/event-stream").path("count").asInt()).isEqualTo(3);
    }

    @Test
    void eventStreamDetectedFromBodyWhenContentTypeMissing() {
        assertThat(parser.parseResult("data: {\"result\":{\"x\":1}}", null).path("x").asInt()).isEqualTo(1);
    }

    @Test
    void rpcErrorBecomesGatewayException() {
        assertThatThrownBy(() -> parser.parseResult(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}",
                "application/json"))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Gateway returned error: Method not found");
    }

    @Test
    void unreadableBodiesAreGatewayExceptions() {
        assertThatThrownBy(() -> parser.parseResult("", "application/json")).isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> parser.parseResult("<html>", "text/html")).isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> parser.parseResult("event: ping\n\n", "text/event-stream"))
                .isInstanceOf(GatewayException.class);
    }

    @Test
    void toolPayloadPrefersStructuredContent() throws Exception {
        JsonNode result = objectMapper.readTree(
                "{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"from\\\":\\\"text\\\"}\"}],"
                        + "\"structuredContent\":{\"from\":\"structured\"}}");

        assertThat(parser.toolPayload(result).path("from").asText()).isEqualTo("structured");
    }

    @Test
    void toolPayloadParsesTextContent() throws Exception {
        JsonNode result = objectMapper.readTree("{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"count\\\":2}\"}]}");

        assertThat(parser.toolPayload(result).path("count").asInt()).isEqualTo(2);
    }

    @Test
    void toolErrorIsGatewayException() throws Exception {
        JsonNode result = objectMapper.readTree(
                "{\"isError\":true,\"content\":[{\"type\":\"text\",\"text\":\"backend down\"}]}");

        assertThatThrownBy(() -> parser.toolPayload(result))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("backend down");
    }
}
