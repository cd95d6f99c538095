package com.peerwarden.api.keys;

/**
 * A freshly generated WireGuard key pair, plus a preshared key when requested.
 * The public key is always derived from the private key.
 */
public record GeneratedKeys(String privateKey, String publicKey, String presharedKey) {

    public boolean hasPresharedKey() {
        return presharedKey != null;
    }

    @Override
    public String toString() {
        return "GeneratedKeys[publicKey=" + WireGuardKeys.redact(publicKey)
                + ", hasPresharedKey=" + hasPresharedKey() + "]";
    }
}
