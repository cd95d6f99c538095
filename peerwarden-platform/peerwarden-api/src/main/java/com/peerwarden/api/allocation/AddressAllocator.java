package com.peerwarden.api.allocation;

import com.peerwarden.api.config.WireGuardProperties;
import com.peerwarden.api.router.RouterClient;
import com.peerwarden.api.router.RouterPeer;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the next free client address in the configured /24.
 * 
 * Hosts .2 through .254 are scanned in order (.1 is the router side of the
 * tunnel). The result is advisory: nothing is reserved, so two concurrent
 * callers can be handed the same address.
 */
@Service
public class AddressAllocator {

    static final int FIRST_HOST = 2;
    static final int LAST_HOST = 254;

    private final RouterClient routerClient;
    private final WireGuardProperties wireGuard;

    public AddressAllocator(RouterClient routerClient, WireGuardProperties wireGuard) {
        this.routerClient = routerClient;
        this.wireGuard = wireGuard;
    }

    /**
     * Next free {@code base.N/32} given the peers currently on the router.
     */
    public String nextAddress() {
        return nextAddress(wireGuard.clientSubnet(), routerClient.listPeers());
    }

    static String nextAddress(String subnetPrefix, List<RouterPeer> peers) {
        Set<String> used = usedAddresses(peers.stream().map(RouterPeer::allowedAddress).toList());
        for (int host = FIRST_HOST; host <= LAST_HOST; host++) {
            String candidate = subnetPrefix + "." + host;
            if (!used.contains(candidate)) {
                return candidate + "/32";
            }
        }
        throw new AddressPoolExhaustedException("No available IP addresses in " + subnetPrefix + ".0/24");
    }

    /**
     * Bare addresses from allowed-address values, which may be comma separated lists of CIDRs.
     */
    static Set<String> usedAddresses(Collection<String> allowedAddresses) {
        Set<String> used = new HashSet<>();
        for (String allowed : allowedAddresses) {
            if (allowed == null) {
                continue;
            }
            for (String entry : allowed.split(",")) {
                String address = entry.trim();
                int slash = address.indexOf('/');
                if (slash >= 0) {
                    address = address.substring(0, slash);
                }
                if (!address.isEmpty()) {
                    used.add(address);
                }
            }
        }
        return used;
    }
}
