package com.peerwarden.api.health;

import com.peerwarden.api.config.WireGuardProperties;
import com.peerwarden.api.custody.KeyCustodyStore;
import com.peerwarden.api.router.RouterClient;
import com.peerwarden.api.router.RouterInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service health as seen from its two dependencies.
 *
 * {@code /health} asks the router for the managed interface and counts the
 * custody records; any failure turns the response into a 503 naming the
 * component that failed. {@code /info} only reports configuration.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final RouterClient routerClient;
    private final KeyCustodyStore custodyStore;
    private final WireGuardProperties wireGuard;

    public HealthController(RouterClient routerClient, KeyCustodyStore custodyStore, WireGuardProperties wireGuard) {
        this.routerClient = routerClient;
        this.custodyStore = custodyStore;
        this.wireGuard = wireGuard;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> router = routerStatus();
        Map<String, Object> custody = custodyStatus();
        boolean up = "UP".equals(router.get("status")) && "UP".equals(custody.get("status"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "UP" : "DOWN");
        body.put("router", router);
        body.put("custody", custody);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Peerwarden");
        body.put("description", "WireGuard peer provisioning and key custody for MikroTik RouterOS");
        body.put("interfaceName", wireGuard.hasInterfaceName() ? wireGuard.interfaceName() : "auto");
        body.put("serverEndpoint", wireGuard.serverEndpoint());
        body.put("addressPool", wireGuard.clientSubnet() + ".0/24");
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> routerStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        try {
            RouterInterface managed = routerClient.getInterfaceInfo();
            status.put("status", "UP");
            status.put("interface", managed.name());
            status.put("serverKeyConfigured", managed.hasPublicKey());
        } catch (RuntimeException e) {
            log.warn("Health check could not reach the router: {}", e.getMessage());
            status.put("status", "DOWN");
            status.put("error", String.valueOf(e.getMessage()));
        }
        return status;
    }

    private Map<String, Object> custodyStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        try {
            status.put("records", custodyStore.listAll().size());
            status.put("status", "UP");
        } catch (RuntimeException e) {
            log.warn("Health check could not read the custody store: {}", e.getMessage());
            status.put("status", "DOWN");
            status.put("error", String.valueOf(e.getMessage()));
        }
        return status;
    }
}
