package com.peerwarden.api.keys;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.security.SecureRandom;

/**
 * In-process Curve25519 backend built on BouncyCastle's X25519.
 */
public class Curve25519KeyStrategy implements KeyGenerationStrategy {

    private static final String X25519_CLASS = "org.bouncycastle.crypto.params.X25519PrivateKeyParameters";

    private final SecureRandom secureRandom;

    public Curve25519KeyStrategy() {
        this(new SecureRandom());
    }

    Curve25519KeyStrategy(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public String name() {
        return "curve25519";
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName(X25519_CLASS, false, getClass().getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    @Override
    public GeneratedKeys generate(boolean includePresharedKey) {
        byte[] privateBytes = new byte[WireGuardKeys.KEY_BYTES];
        secureRandom.nextBytes(privateBytes);

        // Clamp the scalar the way wg genkey does
        privateBytes[0] &= (byte) 248;
        privateBytes[31] &= 127;
        privateBytes[31] |= 64;

        String privateKey = WireGuardKeys.encode(privateBytes);
        String publicKey = derivePublicKey(privateKey);
        String presharedKey = includePresharedKey ? generatePresharedKey() : null;
        return new GeneratedKeys(privateKey, publicKey, presharedKey);
    }

    @Override
    public String generatePresharedKey() {
        byte[] psk = new byte[WireGuardKeys.KEY_BYTES];
        secureRandom.nextBytes(psk);
        return WireGuardKeys.encode(psk);
    }

    /**
     * X25519 base-point multiplication of a base64 private key, the equivalent of {@code wg pubkey}.
     */
    public static String derivePublicKey(String privateKey) {
        X25519PrivateKeyParameters privateParams =
                new X25519PrivateKeyParameters(WireGuardKeys.decode(privateKey), 0);
        X25519PublicKeyParameters publicParams = privateParams.generatePublicKey();
        return WireGuardKeys.encode(publicParams.getEncoded());
    }
}
