package com.peerwarden.api.router;

import com.peerwarden.api.config.WireGuardProperties;
import com.peerwarden.routeros.CreateOutcome;
import com.peerwarden.routeros.RouterOsClient;
import com.peerwarden.routeros.RouterOsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link RouterClient} backed by the RouterOS REST API.
 * 
 * Peers are always fetched as a full listing and filtered locally, since
 * RouterOS query filtering behaves differently across versions.
 */
@Component
public class MikrotikRouterClient implements RouterClient {

    private static final Logger log = LoggerFactory.getLogger(MikrotikRouterClient.class);

    static final String INTERFACES = "/interface/wireguard";
    static final String PEERS = "/interface/wireguard/peers";

    private final RouterOsClient routerOs;
    private final WireGuardProperties wireGuard;

    private volatile String interfaceName;

    public MikrotikRouterClient(RouterOsClient routerOs, WireGuardProperties wireGuard) {
        this.routerOs = routerOs;
        this.wireGuard = wireGuard;
    }

    @Override
    public List<RouterPeer> listPeers() {
        String managed = resolveInterfaceName();
        try {
            return routerOs.print(PEERS).stream()
                    .map(RouterPeer::fromAttributes)
                    .filter(peer -> peer.interfaceName() == null || managed.equals(peer.interfaceName()))
                    .toList();
        } catch (RouterOsException e) {
            if (e.isNotFound()) {
                log.info("No WireGuard peers found or WireGuard not properly configured");
                return List.of();
            }
            throw new RouterUnavailableException("Failed to get peers: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RouterUnavailableException("Failed to get peers: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            throw interrupted("get peers", e);
        }
    }

    @Override
    public Optional<RouterPeer> getPeer(String id) {
        List<Map<String, String>> all = call("get peer", () -> routerOs.print(PEERS));
        Optional<RouterPeer> peer = all.stream()
                .filter(attributes -> id.equals(attributes.get(".id")))
                .findFirst()
                .map(RouterPeer::fromAttributes);
        if (peer.isEmpty()) {
            log.debug("Peer {} not found. Available IDs: {}", id,
                    all.stream().map(attributes -> attributes.get(".id")).toList());
        }
        return peer;
    }

    @Override
    public CreateOutcome createPeer(PeerFields fields) {
        PeerFields target = fields.interfaceName() != null ? fields
                : new PeerFields(resolveInterfaceName(), fields.publicKey(), fields.allowedAddress(),
                        fields.comment(), fields.disabled(), fields.presharedKey());
        log.info("Creating peer {}", target);
        CreateOutcome outcome = call("create peer", () -> routerOs.add(PEERS, target.toAttributes()));
        log.debug("Router create outcome: {}", outcome);
        return outcome;
    }

    @Override
    public void updatePeer(String id, PeerFields fields) {
        singlePeerCall(id, "update peer", () -> {
            routerOs.set(PEERS, id, fields.toAttributes());
            return null;
        });
    }

    @Override
    public void deletePeer(String id) {
        singlePeerCall(id, "delete peer", () -> {
            routerOs.remove(PEERS, id);
            return null;
        });
    }

    @Override
    public RouterInterface getInterfaceInfo() {
        String managed = resolveInterfaceName();
        return listInterfaces().stream()
                .filter(iface -> managed.equals(iface.name()))
                .findFirst()
                .orElseThrow(() -> new RouterUnavailableException(
                        "WireGuard interface '" + managed + "' disappeared from the router"));
    }

    @Override
    public String resolveInterfaceName() {
        String cached = interfaceName;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (interfaceName == null) {
                interfaceName = lookUpInterfaceName();
            }
            return interfaceName;
        }
    }

    private String lookUpInterfaceName() {
        List<RouterInterface> interfaces = listInterfaces();
        if (interfaces.isEmpty()) {
            throw new RouterUnavailableException(
                    "No WireGuard interfaces found. Please create a WireGuard interface first.");
        }
        if (wireGuard.hasInterfaceName()) {
            return interfaces.stream()
                    .map(RouterInterface::name)
                    .filter(wireGuard.interfaceName()::equals)
                    .findFirst()
                    .orElseThrow(() -> new RouterUnavailableException(
                            "WireGuard interface '" + wireGuard.interfaceName() + "' not found. Available: "
                                    + interfaces.stream().map(RouterInterface::name).collect(Collectors.joining(", "))));
        }
        String first = interfaces.get(0).name();
        log.info("Using WireGuard interface: {}", first);
        return first;
    }

    private List<RouterInterface> listInterfaces() {
        return call("get WireGuard interfaces", () -> routerOs.print(INTERFACES)).stream()
                .map(RouterInterface::fromAttributes)
                .toList();
    }

    private <T> T singlePeerCall(String id, String action, RouterCall<T> call) {
        try {
            return call.execute();
        } catch (RouterOsException e) {
            if (e.isNotFound()) {
                throw new PeerNotFoundException(id);
            }
            throw new RouterUnavailableException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RouterUnavailableException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            throw interrupted(action, e);
        }
    }

    private <T> T call(String action, RouterCall<T> call) {
        try {
            return call.execute();
        } catch (IOException e) {
            throw new RouterUnavailableException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            throw interrupted(action, e);
        }
    }

    private static RouterUnavailableException interrupted(String action, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new RouterUnavailableException("Interrupted while trying to " + action, e);
    }

    @FunctionalInterface
    private interface RouterCall<T> {
        T execute() throws IOException, InterruptedException;
    }
}
