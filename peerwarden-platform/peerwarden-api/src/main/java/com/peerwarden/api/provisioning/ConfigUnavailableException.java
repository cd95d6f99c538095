package com.peerwarden.api.provisioning;

import java.util.List;

/**
 * No custody record exists for the peer, so its private key is unknown and
 * no client configuration can be produced.
 */
public class ConfigUnavailableException extends RuntimeException {

    private final String requestedId;
    private final List<String> availableIds;

    public ConfigUnavailableException(String requestedId, List<String> availableIds) {
        super("Peer configuration not found. Keys may not be stored for this peer.");
        this.requestedId = requestedId;
        this.availableIds = List.copyOf(availableIds);
    }

    public String getRequestedId() {
        return requestedId;
    }

    public List<String> getAvailableIds() {
        return availableIds;
    }
}
