package com.peerwarden.api.provisioning;

/**
 * A peer request failed validation. Raised before anything is changed.
 */
public class InvalidPeerRequestException extends RuntimeException {

    public InvalidPeerRequestException(String message) {
        super(message);
    }
}
