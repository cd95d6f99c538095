package com.peerwarden.api.router;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writable peer attributes. Null fields are left untouched on update.
 */
public record PeerFields(
        String interfaceName,
        String publicKey,
        String allowedAddress,
        String comment,
        Boolean disabled,
        String presharedKey
) {

    public static PeerFields forCreate(String interfaceName, String publicKey, String allowedAddress,
                                       String comment, boolean disabled, String presharedKey) {
        return new PeerFields(interfaceName, publicKey, allowedAddress, comment, disabled, presharedKey);
    }

    public static PeerFields forUpdate(String comment, String allowedAddress, Boolean disabled, String presharedKey) {
        return new PeerFields(null, null, allowedAddress, comment, disabled, presharedKey);
    }

    public static PeerFields disabled(boolean disabled) {
        return new PeerFields(null, null, null, null, disabled, null);
    }

    /**
     * RouterOS attribute map, in RouterOS naming.
     */
    public Map<String, String> toAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        put(attributes, "interface", interfaceName);
        put(attributes, "public-key", publicKey);
        put(attributes, "allowed-address", allowedAddress);
        put(attributes, "comment", comment);
        if (disabled != null) {
            attributes.put("disabled", disabled ? "true" : "false");
        }
        put(attributes, "preshared-key", presharedKey);
        return attributes;
    }

    private static void put(Map<String, String> attributes, String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "PeerFields[interface=" + interfaceName + ", allowedAddress=" + allowedAddress
                + ", comment=" + comment + ", disabled=" + disabled
                + ", hasPresharedKey=" + (presharedKey != null) + "]";
    }
}
