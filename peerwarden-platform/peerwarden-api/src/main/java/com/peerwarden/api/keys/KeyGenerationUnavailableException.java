package com.peerwarden.api.keys;

/**
 * Thrown when no key generation backend can produce keys.
 */
public class KeyGenerationUnavailableException extends RuntimeException {

    public KeyGenerationUnavailableException(String message) {
        super(message);
    }
}
