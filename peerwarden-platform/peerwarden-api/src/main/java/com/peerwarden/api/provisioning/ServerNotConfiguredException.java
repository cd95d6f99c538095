package com.peerwarden.api.provisioning;

/**
 * The router's WireGuard interface reports no public key.
 */
public class ServerNotConfiguredException extends RuntimeException {

    public ServerNotConfiguredException(String message) {
        super(message);
    }
}
