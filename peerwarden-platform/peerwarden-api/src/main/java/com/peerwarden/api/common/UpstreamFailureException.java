package com.peerwarden.api.common;

/**
 * An I/O failure in one of the systems this service coordinates:
 * the router or the key custody store.
 */
public class UpstreamFailureException extends RuntimeException {

    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
