package com.peerwarden.api.provisioning;

/**
 * The router accepted a new peer but its identifier could not be determined.
 */
public class PeerIdResolutionFailedException extends RuntimeException {

    public PeerIdResolutionFailedException(String message) {
        super(message);
    }
}
