package com.peerwarden.api.router;

import com.peerwarden.routeros.CreateOutcome;

import java.util.List;
import java.util.Optional;

/**
 * The router's WireGuard peer table, as the provisioning layer sees it.
 * 
 * Implementations throw {@link RouterUnavailableException} for transport and
 * router-side failures and {@link PeerNotFoundException} when a single-peer
 * operation names a peer the router does not know.
 */
public interface RouterClient {

    /**
     * Peers on the managed interface.
     */
    List<RouterPeer> listPeers();

    Optional<RouterPeer> getPeer(String id);

    /**
     * Creates a peer. The outcome says whether and where the router returned
     * the new peer's identifier; it is not resolved here.
     */
    CreateOutcome createPeer(PeerFields fields);

    void updatePeer(String id, PeerFields fields);

    void deletePeer(String id);

    /**
     * The managed WireGuard interface.
     */
    RouterInterface getInterfaceInfo();

    String resolveInterfaceName();
}
