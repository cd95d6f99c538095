package com.peerwarden.api.provisioning;

import com.peerwarden.api.config.WireGuardProperties;
import com.peerwarden.core.domain.KeyCustodyRecord;
import org.springframework.stereotype.Component;

/**
 * Renders wg-quick client configurations.
 * 
 * Field order and spacing are read by WireGuard client software and must not change.
 */
@Component
public class TunnelConfigRenderer {

    static final int PERSISTENT_KEEPALIVE_SECONDS = 25;

    private final WireGuardProperties wireGuard;

    public TunnelConfigRenderer(WireGuardProperties wireGuard) {
        this.wireGuard = wireGuard;
    }

    public TunnelConfig render(KeyCustodyRecord record, String serverPublicKey) {
        String content = render(record.getPrivateKey(), record.getAllowedAddress(), wireGuard.dns(),
                serverPublicKey, wireGuard.serverEndpoint(), wireGuard.allowedIps(), record.getPresharedKey());
        return new TunnelConfig(fileNameFor(record.getName()), content);
    }

    static String render(String privateKey, String address, String dns, String serverPublicKey,
                         String endpoint, String allowedIps, String presharedKey) {
        StringBuilder config = new StringBuilder()
                .append("[Interface]\n")
                .append("PrivateKey = ").append(privateKey).append('\n')
                .append("Address = ").append(address).append('\n')
                .append("DNS = ").append(dns).append('\n')
                .append('\n')
                .append("[Peer]\n")
                .append("PublicKey = ").append(serverPublicKey).append('\n')
                .append("Endpoint = ").append(endpoint).append('\n')
                .append("AllowedIPs = ").append(allowedIps);
        if (presharedKey != null && !presharedKey.isEmpty()) {
            config.append("\nPresharedKey = ").append(presharedKey);
        }
        config.append("\nPersistentKeepalive = ").append(PERSISTENT_KEEPALIVE_SECONDS);
        return config.toString();
    }

    /**
     * Peer name reduced to {@code [A-Za-z0-9-_]}, or {@code peer} when blank, plus {@code .conf}.
     */
    static String fileNameFor(String name) {
        String base = name != null && !name.trim().isEmpty()
                ? name.replaceAll("[^a-zA-Z0-9_-]", "_")
                : "peer";
        return base + ".conf";
    }
}
