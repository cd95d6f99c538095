package com.peerwarden.api.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Checks router connectivity once the application is up. A failure is logged
 * and the service keeps running; peer operations fail until the router is reachable.
 */
@Component
public class RouterConnectionCheck {

    private static final Logger log = LoggerFactory.getLogger(RouterConnectionCheck.class);

    private final RouterClient routerClient;

    public RouterConnectionCheck(RouterClient routerClient) {
        this.routerClient = routerClient;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkConnection() {
        try {
            String name = routerClient.resolveInterfaceName();
            log.info("Router connection test successful, managing WireGuard interface {}", name);
        } catch (RuntimeException e) {
            log.warn("Router connection test failed: {}. Peer management will not work until the connection is fixed.",
                    e.getMessage());
        }
    }
}
