package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Chooses the router once per process: proxied when the audit gateway is
 * enabled and has a URL, direct otherwise.
 */
@Slf4j
@Component
public class GatewayRouterFactory {

    private final GatewayProperties properties;
    private final DirectGatewayRouter directRouter;
    private final ObjectProvider<ProxiedGatewayRouter> proxiedRouter;
    private final AtomicReference<GatewayRouter> current = new AtomicReference<>();

    public GatewayRouterFactory(GatewayProperties properties, DirectGatewayRouter directRouter,
                                ObjectProvider<ProxiedGatewayRouter> proxiedRouter) {
        this.properties = properties;
        this.directRouter = directRouter;
        this.proxiedRouter = proxiedRouter;
    }

    public GatewayRouter getRouter() {
        GatewayRouter router = current.get();
        if (router != null) return router;
        synchronized (this) {
            router = current.get();
            if (router == null) {
                router = create();
                current.set(router);
            }
            return router;
        }
    }

    public String getRouterType() {
        return getRouter().getType();
    }

    /**
     * Forget the memoized router so the next call re-reads the proxy settings.
     */
    public void reset() {
        current.set(null);
    }

    private GatewayRouter create() {
        GatewayProperties.ProxyConfig proxy = properties.getProxy();
        if (proxy.isActive()) {
            log.info("Audit gateway enabled at {}, using proxied router ({} reads)", proxy.getUrl(), proxy.getReadMode());
            return proxiedRouter.getObject();
        }
        if (proxy.isEnabled()) {
            log.warn("Audit gateway enabled without a URL, using direct router");
        } else {
            log.info("Audit gateway disabled, using direct router");
        }
        return directRouter;
    }
}
