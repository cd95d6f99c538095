package com.peerwarden.api.router;

import java.util.Map;

/**
 * A WireGuard peer as the router reports it. Never persisted locally.
 */
public record RouterPeer(
        String id,
        String interfaceName,
        String publicKey,
        String allowedAddress,
        String comment,
        boolean disabled,
        boolean presharedKeyPresent,
        String endpoint,
        String lastHandshake,
        String rxBytes,
        String txBytes
) {

    /**
     * Maps RouterOS peer attributes, accepting the alternative field names
     * different RouterOS versions use for endpoint and telemetry.
     */
    public static RouterPeer fromAttributes(Map<String, String> attributes) {
        return new RouterPeer(
                attributes.get(".id"),
                attributes.get("interface"),
                attributes.get("public-key"),
                attributes.get("allowed-address"),
                attributes.get("comment"),
                "true".equals(attributes.get("disabled")),
                present(attributes.get("preshared-key")),
                endpoint(attributes),
                firstPresent(attributes, "last-handshake", "last-seen"),
                firstPresent(attributes, "rx", "rx-bytes"),
                firstPresent(attributes, "tx", "tx-bytes")
        );
    }

    public boolean enabled() {
        return !disabled;
    }

    private static String endpoint(Map<String, String> attributes) {
        if (present(attributes.get("endpoint"))) {
            return attributes.get("endpoint");
        }
        String address = attributes.get("endpoint-address");
        if (!present(address)) {
            address = attributes.get("current-endpoint-address");
        }
        if (!present(address)) {
            return null;
        }
        String port = attributes.get("endpoint-port");
        if (!present(port) || "0".equals(port)) {
            port = attributes.get("current-endpoint-port");
        }
        return present(port) && !"0".equals(port) ? address + ":" + port : address;
    }

    private static String firstPresent(Map<String, String> attributes, String... keys) {
        for (String key : keys) {
            if (present(attributes.get(key))) {
                return attributes.get(key);
            }
        }
        return null;
    }

    private static boolean present(String value) {
        return value != null && !value.isEmpty();
    }
}
