package com.example.devopsgateway.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * Session-oriented RPC channel to the external audit gateway.
 */
public interface GatewayTransport {

    /**
     * Call a gateway tool, performing the session handshake first if needed.
     *
     * @return the tool payload
     * @throws com.example.devopsgateway.exception.GatewayException on any transport, status or RPC failure
     */
    JsonNode callTool(RequestContext ctx, String toolName, Map<String, Object> arguments);

    GatewaySessionState getState();

    Optional<String> getSessionId();

    /**
     * Number of completed handshakes since startup.
     */
    int getHandshakeCount();
}
