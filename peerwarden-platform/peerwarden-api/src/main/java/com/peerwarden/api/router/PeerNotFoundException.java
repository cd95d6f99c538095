package com.peerwarden.api.router;

/**
 * Thrown when a peer is not present on the router.
 */
public class PeerNotFoundException extends RuntimeException {

    private final String peerId;

    public PeerNotFoundException(String peerId) {
        super("Peer not found: " + peerId);
        this.peerId = peerId;
    }

    public String getPeerId() {
        return peerId;
    }
}
