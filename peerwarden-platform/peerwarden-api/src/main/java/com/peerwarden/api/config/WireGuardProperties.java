package com.peerwarden.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * WireGuard tunnel settings: which router interface to manage, how client
 * addresses are allocated and what goes into exported client configurations.
 *
 * @param interfaceName router interface to manage; when blank the first WireGuard interface is used
 * @param clientSubnet  first three octets of the client /24, e.g. {@code 172.16.0}
 * @param serverEndpoint public {@code host:port} clients connect to
 * @param serverPort    listen port reported when the router does not report one
 * @param allowedIps    AllowedIPs written into client configurations
 * @param dns           resolver written into client configurations
 */
@ConfigurationProperties(prefix = "peerwarden.wireguard")
public record WireGuardProperties(
        String interfaceName,
        @DefaultValue("172.16.0") String clientSubnet,
        @DefaultValue("your.server.com:51820") String serverEndpoint,
        @DefaultValue("51820") int serverPort,
        @DefaultValue("0.0.0.0/0") String allowedIps,
        @DefaultValue("172.16.0.1") String dns
) {

    public boolean hasInterfaceName() {
        return interfaceName != null && !interfaceName.isBlank();
    }
}
