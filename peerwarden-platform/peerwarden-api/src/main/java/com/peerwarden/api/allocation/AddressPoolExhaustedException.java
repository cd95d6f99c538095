package com.peerwarden.api.allocation;

/**
 * Thrown when every host address in the client subnet is taken.
 */
public class AddressPoolExhaustedException extends RuntimeException {

    public AddressPoolExhaustedException(String message) {
        super(message);
    }
}
