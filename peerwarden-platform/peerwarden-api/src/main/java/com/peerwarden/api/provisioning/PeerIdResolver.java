package com.peerwarden.api.provisioning;

import com.peerwarden.api.keys.WireGuardKeys;
import com.peerwarden.api.router.PeerFields;
import com.peerwarden.api.router.RouterClient;
import com.peerwarden.api.router.RouterPeer;
import com.peerwarden.routeros.CreateOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Turns a create outcome into the new peer's router identifier.
 * 
 * When the router returned no identifier, the peer is looked up by the exact
 * public key and comment just submitted; public keys are unique per interface.
 */
@Component
public class PeerIdResolver {

    private static final Logger log = LoggerFactory.getLogger(PeerIdResolver.class);

    private final RouterClient routerClient;

    public PeerIdResolver(RouterClient routerClient) {
        this.routerClient = routerClient;
    }

    public String resolve(CreateOutcome outcome, PeerFields submitted) {
        if (outcome instanceof CreateOutcome.DirectId direct) {
            return direct.id();
        }
        if (outcome instanceof CreateOutcome.NestedId nested) {
            return nested.id();
        }

        log.info("No ID returned, searching for newly created peer...");
        String id = routerClient.listPeers().stream()
                .filter(peer -> Objects.equals(peer.publicKey(), submitted.publicKey())
                        && Objects.equals(peer.comment(), submitted.comment()))
                .map(RouterPeer::id)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);

        if (id == null) {
            // The peer may exist on the router; deleting on a guess could hit an unrelated peer
            log.error("Could not resolve ID for peer '{}' with public key {}; any router-side peer is left in place",
                    submitted.comment(), WireGuardKeys.redact(submitted.publicKey()));
            throw new PeerIdResolutionFailedException("Failed to get ID for newly created peer");
        }
        log.info("Found newly created peer with ID: {}", id);
        return id;
    }
}
