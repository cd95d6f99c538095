package com.peerwarden.api.provisioning;

import com.peerwarden.api.allocation.AddressAllocator;
import com.peerwarden.api.common.UpstreamFailureException;
import com.peerwarden.api.config.WireGuardProperties;
import com.peerwarden.api.custody.CustodyStoreException;
import com.peerwarden.api.custody.KeyCustodyStore;
import com.peerwarden.api.keys.GeneratedKeys;
import com.peerwarden.api.keys.InvalidGeneratedKeyException;
import com.peerwarden.api.keys.KeyGenerationService;
import com.peerwarden.api.keys.WireGuardKeys;
import com.peerwarden.api.reconcile.OrphanReconciler;
import com.peerwarden.api.router.PeerFields;
import com.peerwarden.api.router.PeerNotFoundException;
import com.peerwarden.api.router.RouterClient;
import com.peerwarden.api.router.RouterInterface;
import com.peerwarden.api.router.RouterPeer;
import com.peerwarden.api.saga.Saga;
import com.peerwarden.api.saga.SagaContext;
import com.peerwarden.api.saga.SagaFailedException;
import com.peerwarden.core.domain.KeyCustodyRecord;
import com.peerwarden.routeros.CreateOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Provisions WireGuard peers on the router and keeps their private material
 * in custody.
 *
 * The router and the custody store share no transaction. Multi-step
 * operations run as sagas: when persisting custody fails after the router
 * peer was created, the router peer is deleted again. If that compensation
 * fails too, both failures are reported and the leftover is for the
 * {@link OrphanReconciler} or an operator.
 *
 * No locking is done here. Concurrent creates can be handed the same address,
 * and concurrent updates of one peer are last-write-wins.
 */
@Service
public class PeerProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(PeerProvisioningService.class);

    private static final String ROUTER_ID = "routerId";
    private static final String CUSTODY_RECORD = "custodyRecord";

    private static final Pattern IPV4_CIDR = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(/(3[0-2]|[12]?\\d))?$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^(?=[^:]*:)[0-9a-fA-F:][0-9a-fA-F:.]*$");
    private static final Pattern IPV6_PREFIX = Pattern.compile("^(12[0-8]|1[01]\\d|[1-9]?\\d)$");

    /** Width of the custody table's name column. */
    static final int MAX_NAME_LENGTH = 255;

    private final RouterClient routerClient;
    private final KeyCustodyStore custodyStore;
    private final KeyGenerationService keyGenerationService;
    private final AddressAllocator addressAllocator;
    private final PeerIdResolver peerIdResolver;
    private final TunnelConfigRenderer configRenderer;
    private final OrphanReconciler orphanReconciler;
    private final WireGuardProperties wireGuard;

    public PeerProvisioningService(
            RouterClient routerClient,
            KeyCustodyStore custodyStore,
            KeyGenerationService keyGenerationService,
            AddressAllocator addressAllocator,
            PeerIdResolver peerIdResolver,
            TunnelConfigRenderer configRenderer,
            OrphanReconciler orphanReconciler,
            WireGuardProperties wireGuard) {
        this.routerClient = routerClient;
        this.custodyStore = custodyStore;
        this.keyGenerationService = keyGenerationService;
        this.addressAllocator = addressAllocator;
        this.peerIdResolver = peerIdResolver;
        this.configRenderer = configRenderer;
        this.orphanReconciler = orphanReconciler;
        this.wireGuard = wireGuard;
    }

    /**
     * Lists router peers with their custody status, optionally removing
     * orphaned custody records first.
     */
    public List<PeerView> listPeers(boolean includeCleanup) {
        if (includeCleanup) {
            orphanReconciler.reconcileOrphans();
        }
        List<RouterPeer> peers = routerClient.listPeers();
        Map<String, KeyCustodyRecord> custody = custodyStore.listAll().stream()
                .collect(Collectors.toMap(KeyCustodyRecord::getRouterId, Function.identity(), (a, b) -> a));

        return peers.stream()
                .map(peer -> PeerView.of(peer, custody.get(peer.id())))
                .toList();
    }

    /**
     * Creates a router peer with fresh keys and takes custody of its private material.
     */
    public PeerView createPeer(NewPeer request) {
        String name = requireName(request.name());
        String requestedAddress = normalizeAddress(request.allowedAddress());

        String interfaceName = routerClient.resolveInterfaceName();
        GeneratedKeys keys = keyGenerationService.generate(request.usePresharedKey());
        requireValidKey(keys.publicKey(), "public key");
        if (request.usePresharedKey() || keys.hasPresharedKey()) {
            requireValidKey(keys.presharedKey(), "preshared key");
        }

        String address = requestedAddress != null ? requestedAddress : addressAllocator.nextAddress();
        PeerFields fields = PeerFields.forCreate(
                interfaceName, keys.publicKey(), address, name, false, keys.presharedKey());

        log.info("Creating peer \"{}\" at {}{}", name, address, keys.hasPresharedKey() ? " with preshared key" : "");
        SagaContext context = runSaga(createSaga("create-peer", fields, keys));

        String routerId = context.get(ROUTER_ID, String.class);
        KeyCustodyRecord saved = context.get(CUSTODY_RECORD, KeyCustodyRecord.class);
        log.info("Peer \"{}\" created with router ID {}", name, routerId);
        return PeerView.fresh(routerId, name, keys.publicKey(), address, true,
                keys.hasPresharedKey(), saved.getCreatedAt(), null);
    }

    /**
     * Updates a peer in place, or replaces it with a newly keyed peer when
     * {@code regenerateCompletely} is set. Regeneration changes the peer's id;
     * the returned view carries the new one.
     */
    public PeerView updatePeer(String id, PeerChanges changes) {
        String name = requireName(changes.name());
        String address = normalizeAddress(changes.allowedAddress());
        RouterPeer current = routerClient.getPeer(id).orElseThrow(() -> new PeerNotFoundException(id));

        if (changes.regenerateCompletely()) {
            String keptAddress = address != null ? address : current.allowedAddress();
            if (keptAddress == null || keptAddress.isBlank()) {
                keptAddress = addressAllocator.nextAddress();
                log.info("Peer {} has no allowed address; regenerating it at {}", id, keptAddress);
            }
            return regenerate(current, name, keptAddress, changes.enabled());
        }

        boolean disabled = changes.enabled() != null ? !changes.enabled() : current.disabled();
        String presharedKey = null;
        if (changes.updatePresharedKey()) {
            presharedKey = keyGenerationService.generatePresharedKey();
            requireValidKey(presharedKey, "preshared key");
        }

        routerClient.updatePeer(id, PeerFields.forUpdate(name, address, disabled, presharedKey));
        log.info("Updated peer \"{}\" ({})", name, id);

        boolean hasStoredKeys;
        if (presharedKey != null) {
            hasStoredKeys = rotateCustodiedPresharedKey(id, presharedKey);
        } else {
            hasStoredKeys = custodyStore.get(id).isPresent();
        }

        PeerView view = new PeerView(
                id, name, current.publicKey(), address != null ? address : current.allowedAddress(),
                current.endpoint() != null ? current.endpoint() : "", !disabled,
                current.lastHandshake() != null ? current.lastHandshake() : PeerView.NEVER,
                current.rxBytes() != null ? current.rxBytes() : "0",
                current.txBytes() != null ? current.txBytes() : "0",
                current.presharedKeyPresent(), hasStoredKeys, null, null, null);
        return presharedKey != null ? view.withNewPresharedKey(presharedKey) : view;
    }

    /**
     * Flips a peer between enabled and disabled.
     */
    public ToggleResult togglePeer(String id) {
        RouterPeer current = routerClient.getPeer(id).orElseThrow(() -> new PeerNotFoundException(id));
        boolean nowEnabled = current.disabled();

        log.info("Peer \"{}\" - Current: {}, New: {}", PeerView.displayName(current),
                current.enabled() ? "Enabled" : "Disabled", nowEnabled ? "Enabled" : "Disabled");
        routerClient.updatePeer(id, PeerFields.disabled(!nowEnabled));

        RouterPeer updated = routerClient.getPeer(id).orElseThrow(() -> new PeerNotFoundException(id));
        return new ToggleResult(updated.id(), PeerView.displayName(updated), updated.enabled(),
                "Peer " + (nowEnabled ? "enabled" : "disabled") + " successfully");
    }

    /**
     * Deletes a peer from the router and its custody record. A router-side
     * failure is logged and does not stop the custody cleanup.
     */
    public DeleteResult deletePeer(String id) {
        try {
            routerClient.deletePeer(id);
        } catch (PeerNotFoundException | UpstreamFailureException e) {
            log.warn("Failed to delete peer {} from router (may already be deleted): {}", id, e.getMessage());
        }
        custodyStore.delete(id);
        return new DeleteResult(true, "Peer deleted (including orphaned data if any)");
    }

    /**
     * Renders the client configuration of a custodied peer.
     */
    public TunnelConfig exportConfig(String id) {
        String peerId = id == null ? "" : id.trim();
        if (peerId.isEmpty() || "undefined".equals(peerId) || "null".equals(peerId)) {
            throw new InvalidPeerRequestException("Invalid peer ID provided");
        }

        KeyCustodyRecord record = custodyStore.get(peerId).orElseThrow(() -> {
            List<String> available = custodyStore.listAll().stream().map(KeyCustodyRecord::getRouterId).toList();
            log.info("No custody record for peer {}. Available peer IDs: {}", peerId, available);
            return new ConfigUnavailableException(peerId, available);
        });

        RouterInterface serverInterface = routerClient.getInterfaceInfo();
        if (!serverInterface.hasPublicKey()) {
            throw new ServerNotConfiguredException(
                    "Server public key not configured. Please check WireGuard interface setup.");
        }

        TunnelConfig config = configRenderer.render(record, serverInterface.publicKey());
        log.info("Config generated for: {} (file: {})", record.getName(), config.fileName());
        return config;
    }

    public ServerInfo getServerInfo() {
        RouterInterface serverInterface = routerClient.getInterfaceInfo();
        if (!serverInterface.hasPublicKey()) {
            log.warn("No server public key found. Please check WireGuard interface configuration.");
        }
        return new ServerInfo(
                serverInterface.publicKey(),
                wireGuard.serverEndpoint(),
                serverInterface.listenPort() != null ? serverInterface.listenPort() : wireGuard.serverPort(),
                wireGuard.allowedIps(),
                serverInterface.name() != null ? serverInterface.name()
                        : wireGuard.hasInterfaceName() ? wireGuard.interfaceName() : "wg0");
    }

    // ==================== Regeneration ====================

    private PeerView regenerate(RouterPeer current, String name, String address, Boolean enabled) {
        GeneratedKeys keys = keyGenerationService.generate(true);
        requireValidKey(keys.publicKey(), "public key");
        requireValidKey(keys.presharedKey(), "preshared key");

        String oldId = current.id();
        String interfaceName = current.interfaceName() != null
                ? current.interfaceName() : routerClient.resolveInterfaceName();
        boolean disabled = enabled != null ? !enabled : current.disabled();
        PeerFields fields = PeerFields.forCreate(
                interfaceName, keys.publicKey(), address, name, disabled, keys.presharedKey());

        Saga saga = Saga.named("regenerate-peer")
                .step("delete-old-router-peer", context -> routerClient.deletePeer(oldId))
                .step("delete-old-custody-record", context -> custodyStore.delete(oldId))
                .step("create-router-peer",
                        context -> context.put(ROUTER_ID, createRouterPeer(fields)),
                        context -> routerClient.deletePeer(context.get(ROUTER_ID, String.class)))
                .step("save-custody-record", context -> context.put(CUSTODY_RECORD, custodyStore.save(
                        KeyCustodyRecord.create(context.get(ROUTER_ID, String.class), name,
                                keys.privateKey(), keys.presharedKey(), address))))
                .build();

        SagaContext context = runSaga(saga);
        String newId = context.get(ROUTER_ID, String.class);
        KeyCustodyRecord saved = context.get(CUSTODY_RECORD, KeyCustodyRecord.class);
        log.info("Peer \"{}\" completely regenerated with preshared key ({} -> {})", name, oldId, newId);
        return PeerView.fresh(newId, name, keys.publicKey(), address, !disabled, true, saved.getCreatedAt(), true);
    }

    // ==================== Helpers ====================

    private Saga createSaga(String sagaName, PeerFields fields, GeneratedKeys keys) {
        return Saga.named(sagaName)
                .step("create-router-peer",
                        context -> context.put(ROUTER_ID, createRouterPeer(fields)),
                        context -> {
                            String routerId = context.get(ROUTER_ID, String.class);
                            routerClient.deletePeer(routerId);
                            log.info("Cleaned up router peer {} after custody failure", routerId);
                        })
                .step("save-custody-record", context -> context.put(CUSTODY_RECORD, custodyStore.save(
                        KeyCustodyRecord.create(context.get(ROUTER_ID, String.class), fields.comment(),
                                keys.privateKey(), keys.presharedKey(), fields.allowedAddress()))))
                .build();
    }

    private String createRouterPeer(PeerFields fields) {
        CreateOutcome outcome = routerClient.createPeer(fields);
        String routerId = peerIdResolver.resolve(outcome, fields);
        if (routerId == null || routerId.isBlank()) {
            throw new PeerIdResolutionFailedException("Failed to get valid router peer ID");
        }
        return routerId;
    }

    /**
     * The router already holds the new key at this point; a custody failure
     * leaves the stored key stale until the next rotation or regeneration.
     */
    private boolean rotateCustodiedPresharedKey(String id, String presharedKey) {
        try {
            boolean updated = custodyStore.updatePresharedKey(id, presharedKey);
            if (!updated) {
                log.warn("Peer {} has no custody record; its new preshared key is only on the router", id);
            }
            return updated;
        } catch (CustodyStoreException e) {
            log.error("Preshared key of peer {} was rotated on the router but the custody record is stale: {}",
                    id, e.getMessage());
            throw e;
        }
    }

    private static SagaContext runSaga(Saga saga) {
        try {
            return saga.run();
        } catch (SagaFailedException e) {
            if (!e.isFullyCompensated()) {
                throw e;
            }
            if (e.getCause() instanceof RuntimeException original) {
                throw original;
            }
            throw new UpstreamFailureException(e.getMessage(), e.getCause());
        }
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidPeerRequestException("Peer name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidPeerRequestException("Peer name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static String normalizeAddress(String allowedAddress) {
        if (allowedAddress == null || allowedAddress.isBlank()) {
            return null;
        }
        List<String> entries = Arrays.stream(allowedAddress.split(",", -1))
                .map(String::trim)
                .toList();
        for (String entry : entries) {
            if (!IPV4_CIDR.matcher(entry).matches() && !isIpv6Cidr(entry)) {
                throw new InvalidPeerRequestException("Invalid allowed address: " + entry);
            }
        }
        return String.join(",", entries);
    }

    /**
     * Only colon-bearing strings of hex digits, colons and dots reach {@link InetAddress},
     * which parses them as literals without a name lookup.
     */
    private static boolean isIpv6Cidr(String entry) {
        int slash = entry.indexOf('/');
        String host = slash < 0 ? entry : entry.substring(0, slash);
        if (slash >= 0 && !IPV6_PREFIX.matcher(entry.substring(slash + 1)).matches()) {
            return false;
        }
        if (!IPV6_CHARS.matcher(host).matches()) {
            return false;
        }
        try {
            InetAddress.getByName(host);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    private static void requireValidKey(String key, String kind) {
        if (!WireGuardKeys.isValid(key)) {
            throw new InvalidGeneratedKeyException("Generated invalid " + kind);
        }
    }

    // ==================== Requests ====================

    /**
     * @param allowedAddress address to assign; the next free one when null
     */
    public record NewPeer(String name, String allowedAddress, boolean usePresharedKey) {}

    /**
     * @param enabled null keeps the current state
     * @param allowedAddress null keeps the current address
     */
    public record PeerChanges(
            String name,
            String allowedAddress,
            Boolean enabled,
            boolean updatePresharedKey,
            boolean regenerateCompletely
    ) {}
}
