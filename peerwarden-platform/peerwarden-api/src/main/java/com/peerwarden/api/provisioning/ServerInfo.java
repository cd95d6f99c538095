package com.peerwarden.api.provisioning;

/**
 * What clients need to know about the router side of the tunnel.
 */
public record ServerInfo(String publicKey, String endpoint, int port, String allowedIPs, String interfaceName) {}
