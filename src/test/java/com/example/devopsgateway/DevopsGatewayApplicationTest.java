package com.example.devopsgateway;

import com.example.devopsgateway.gateway.GatewayRouterFactory;
import com.example.devopsgateway.gateway.McpRpcRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DevopsGatewayApplicationTest {

    @Autowired
    private GatewayRouterFactory routerFactory;

    @Autowired
    private McpRpcRouter rpcRouter;

    @Test
    void contextLoads() {
        assertThat(routerFactory.getRouterType()).isEqualTo("direct");
        assertThat(rpcRouter.listMethods()).containsKeys("initialize", "tools/list", "tools/call");
    }
}
