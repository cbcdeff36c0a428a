package com.example.devopsgateway.gateway;

import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.PermissionDeniedException;
import com.example.devopsgateway.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class McpRpcRouterTest {

    private McpRpcRouter router;
    private final McpInvocation invocation = McpInvocation.builder().context(RequestContext.internal()).build();

    @BeforeEach
    void setUp() {
        router = new McpRpcRouter(new ObjectMapper());
        router.registerMethod("echo", (params, inv) -> Map.of("text", params.path("text").asText()));
        router.registerMethod("login", (params, inv) -> {
            throw new AuthenticationException("Not authenticated");
        });
        router.registerMethod("deploy", (params, inv) -> {
            throw new PermissionDeniedException("Permission denied");
        });
        router.registerMethod("validate", (params, inv) -> {
            throw new ValidationException("limit must be between 1 and 1000");
        });
        router.registerMethod("boom", (params, inv) -> {
            throw new IllegalStateException("kaput");
        });
    }

    @Test
    void routesParamsToHandler() {
        JsonRpcMessage response = router.route(JsonRpcMessage.request(7, "echo", Map.of("text", "hi")), invocation);

        assertThat(response.getId()).isEqualTo(7);
        assertThat(response.getError()).isNull();
        assertThat(response.getResult()).isEqualTo(Map.of("text", "hi"));
    }

    @Test
    void missingAndUnknownMethods() {
        assertThat(router.route(JsonRpcMessage.request(1, null, null), invocation).getError().getCode())
                .isEqualTo(JsonRpcMessage.INVALID_REQUEST);
        assertThat(router.route(JsonRpcMessage.request(1, "nope", null), invocation).getError().getCode())
                .isEqualTo(JsonRpcMessage.METHOD_NOT_FOUND);
    }

    @Test
    void errorTaxonomyMapsToRpcCodes() {
        assertThat(code("login")).isEqualTo(JsonRpcMessage.UNAUTHENTICATED);
        assertThat(code("deploy")).isEqualTo(JsonRpcMessage.FORBIDDEN);
        assertThat(code("validate")).isEqualTo(JsonRpcMessage.INVALID_PARAMS);
        assertThat(code("boom")).isEqualTo(JsonRpcMessage.INTERNAL_ERROR);
    }

    @Test
    void listsRegisteredMethods() {
        assertThat(router.listMethods()).containsKeys("echo", "boom");
        assertThat(router.getMethodCount()).isEqualTo(5);
    }

    private int code(String method) {
        return router.route(JsonRpcMessage.request("x", method, Map.of()), invocation).getError().getCode();
    }
}
