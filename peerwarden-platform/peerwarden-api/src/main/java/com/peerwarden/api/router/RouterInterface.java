package com.peerwarden.api.router;

import java.util.Map;

/**
 * A WireGuard interface on the router.
 */
public record RouterInterface(String id, String name, String publicKey, Integer listenPort, boolean disabled) {

    public static RouterInterface fromAttributes(Map<String, String> attributes) {
        return new RouterInterface(
                attributes.get(".id"),
                attributes.get("name"),
                blankToNull(attributes.get("public-key")),
                parsePort(attributes.get("listen-port")),
                "true".equals(attributes.get("disabled"))
        );
    }

    public boolean hasPublicKey() {
        return publicKey != null;
    }

    private static Integer parsePort(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
