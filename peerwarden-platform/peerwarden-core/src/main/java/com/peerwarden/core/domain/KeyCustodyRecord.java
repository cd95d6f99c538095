package com.peerwarden.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Locally custodied key material for a WireGuard peer.
 * 
 * The router never returns a peer's private key after creation, so this record
 * is the only durable copy of it. {@code routerId} references the peer on the
 * router; a record whose peer no longer exists there is an orphan.
 */
@Entity
@Table(name = "peer_keys", indexes = {
    @Index(name = "idx_peer_keys_router_id", columnList = "router_id", unique = true)
})
public class KeyCustodyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "router_id", nullable = false, unique = true)
    private String routerId;

    @NotNull
    @Column(name = "name", nullable = false)
    private String name;

    @NotNull
    @Column(name = "private_key", nullable = false, length = 64)
    private String privateKey;

    @Column(name = "preshared_key", length = 64)
    private String presharedKey;

    @NotNull
    @Column(name = "allowed_address", nullable = false)
    private String allowedAddress;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected KeyCustodyRecord() {}

    /**
     * Creates a new custody record for a peer that already exists on the router.
     */
    public static KeyCustodyRecord create(
            String routerId,
            String name,
            String privateKey,
            String presharedKey,
            String allowedAddress) {

        if (routerId == null || routerId.isBlank()) {
            throw new IllegalArgumentException("Router ID is required");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("Private key is required");
        }

        var record = new KeyCustodyRecord();
        record.routerId = routerId;
        record.name = name;
        record.privateKey = privateKey;
        record.presharedKey = presharedKey;
        record.allowedAddress = allowedAddress;
        record.createdAt = Instant.now();
        record.updatedAt = record.createdAt;
        return record;
    }

    /**
     * Replaces the key material and metadata with those of another record
     * for the same router peer. Creation time is preserved.
     */
    public void replaceWith(KeyCustodyRecord other) {
        if (!routerId.equals(other.routerId)) {
            throw new IllegalArgumentException(
                    "Cannot replace record for " + routerId + " with record for " + other.routerId);
        }
        this.name = other.name;
        this.privateKey = other.privateKey;
        this.presharedKey = other.presharedKey;
        this.allowedAddress = other.allowedAddress;
        this.updatedAt = Instant.now();
    }

    public void rotatePresharedKey(String presharedKey) {
        this.presharedKey = presharedKey;
        this.updatedAt = Instant.now();
    }

    public boolean hasPresharedKey() {
        return presharedKey != null && !presharedKey.isEmpty();
    }

    // Getters
    public UUID getId() { return id; }
    public String getRouterId() { return routerId; }
    public String getName() { return name; }
    public String getPrivateKey() { return privateKey; }
    public String getPresharedKey() { return presharedKey; }
    public String getAllowedAddress() { return allowedAddress; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        // Key material stays out of logs
        return "KeyCustodyRecord{routerId='" + routerId + "', name='" + name
                + "', allowedAddress='" + allowedAddress + "', hasPresharedKey=" + hasPresharedKey() + "}";
    }
}
