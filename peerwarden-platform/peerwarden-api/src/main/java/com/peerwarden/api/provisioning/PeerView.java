package com.peerwarden.api.provisioning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.peerwarden.api.router.RouterPeer;
import com.peerwarden.core.domain.KeyCustodyRecord;

import java.time.Instant;

/**
 * A router peer joined with its custody status.
 * 
 * {@code regenerated} and {@code newPresharedKey} are only set in update responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerView(
        String id,
        String name,
        String publicKey,
        String allowedIPs,
        String endpoint,
        boolean enabled,
        String lastHandshake,
        String transferRx,
        String transferTx,
        boolean hasPresharedKey,
        boolean hasStoredKeys,
        Instant keyCreatedAt,
        Boolean regenerated,
        String newPresharedKey
) {

    static final String UNNAMED = "Unnamed";
    static final String NEVER = "Never";

    /**
     * View of a live router peer; {@code custody} is null when no keys are stored for it.
     */
    public static PeerView of(RouterPeer peer, KeyCustodyRecord custody) {
        return new PeerView(
                peer.id(),
                displayName(peer),
                peer.publicKey(),
                peer.allowedAddress(),
                peer.endpoint() != null ? peer.endpoint() : "",
                peer.enabled(),
                peer.lastHandshake() != null ? peer.lastHandshake() : NEVER,
                peer.rxBytes() != null ? peer.rxBytes() : "0",
                peer.txBytes() != null ? peer.txBytes() : "0",
                peer.presharedKeyPresent(),
                custody != null,
                custody != null ? custody.getCreatedAt() : null,
                null,
                null
        );
    }

    /**
     * View of a peer that was just created on the router and in custody.
     */
    public static PeerView fresh(String id, String name, String publicKey, String allowedAddress,
                                 boolean enabled, boolean hasPresharedKey, Instant keyCreatedAt,
                                 Boolean regenerated) {
        return new PeerView(id, name, publicKey, allowedAddress, "", enabled, NEVER, "0", "0",
                hasPresharedKey, true, keyCreatedAt, regenerated, null);
    }

    public PeerView withNewPresharedKey(String presharedKey) {
        return new PeerView(id, name, publicKey, allowedIPs, endpoint, enabled, lastHandshake, transferRx,
                transferTx, hasPresharedKey || presharedKey != null, hasStoredKeys, keyCreatedAt,
                regenerated, presharedKey);
    }

    static String displayName(RouterPeer peer) {
        return peer.comment() != null && !peer.comment().isEmpty() ? peer.comment() : UNNAMED;
    }
}
