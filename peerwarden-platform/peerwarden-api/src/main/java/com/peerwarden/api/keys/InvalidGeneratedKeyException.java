package com.peerwarden.api.keys;

/**
 * Thrown when a backend produced a key that is not in WireGuard key format.
 * The enclosing operation is aborted before anything is written.
 */
public class InvalidGeneratedKeyException extends RuntimeException {

    public InvalidGeneratedKeyException(String message) {
        super(message);
    }
}
