package com.peerwarden.api.provisioning;

import com.peerwarden.api.allocation.AddressPoolExhaustedException;
import com.peerwarden.api.common.ErrorResponse;
import com.peerwarden.api.common.UpstreamFailureException;
import com.peerwarden.api.custody.CustodyStoreException;
import com.peerwarden.api.keys.InvalidGeneratedKeyException;
import com.peerwarden.api.keys.KeyGenerationUnavailableException;
import com.peerwarden.api.reconcile.OrphanReconciler;
import com.peerwarden.api.reconcile.ReconcileResult;
import com.peerwarden.api.router.PeerNotFoundException;
import com.peerwarden.api.saga.SagaFailedException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Peer provisioning REST API.
 * 
 * - List, create, update, toggle and delete router peers
 * - Export client configurations of custodied peers
 * - Trigger orphan cleanup
 */
@RestController
@RequestMapping("/api/v1")
public class PeerController {

    private static final Logger log = LoggerFactory.getLogger(PeerController.class);

    private final PeerProvisioningService provisioningService;
    private final OrphanReconciler orphanReconciler;

    public PeerController(PeerProvisioningService provisioningService, OrphanReconciler orphanReconciler) {
        this.provisioningService = provisioningService;
        this.orphanReconciler = orphanReconciler;
    }

    /**
     * List peers with custody status.
     * GET /api/v1/peers?cleanup=true
     */
    @GetMapping("/peers")
    public ResponseEntity<List<PeerView>> listPeers(
            @RequestParam(name = "cleanup", defaultValue = "false") boolean cleanup) {
        return ResponseEntity.ok(provisioningService.listPeers(cleanup));
    }

    /**
     * Download a client configuration.
     * GET /api/v1/peers/{id}/config
     */
    @GetMapping("/peers/{id}/config")
    public ResponseEntity<String> getPeerConfig(@PathVariable("id") String id) {
        TunnelConfig config = provisioningService.exportConfig(id);
        return ResponseEntity.ok()
            .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(config.fileName()).build().toString())
            .body(config.content());
    }

    /**
     * Create a peer.
     * POST /api/v1/peers
     */
    @PostMapping("/peers")
    public ResponseEntity<PeerView> createPeer(@Valid @RequestBody CreatePeerRequest request) {
        PeerView created = provisioningService.createPeer(new PeerProvisioningService.NewPeer(
            request.name(),
            request.allowedIPs(),
            request.usePresharedKey() == null || request.usePresharedKey()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * Update a peer, or replace it with a newly keyed one.
     * PUT /api/v1/peers/{id}
     */
    @PutMapping("/peers/{id}")
    public ResponseEntity<PeerView> updatePeer(
            @PathVariable("id") String id,
            @Valid @RequestBody UpdatePeerRequest request) {
        return ResponseEntity.ok(provisioningService.updatePeer(id, new PeerProvisioningService.PeerChanges(
            request.name(),
            request.allowedIPs(),
            request.enabled(),
            Boolean.TRUE.equals(request.updatePresharedKey()),
            Boolean.TRUE.equals(request.regenerateCompletely())
        )));
    }

    /**
     * Delete a peer and its stored keys.
     * DELETE /api/v1/peers/{id}
     */
    @DeleteMapping("/peers/{id}")
    public ResponseEntity<DeleteResult> deletePeer(@PathVariable("id") String id) {
        return ResponseEntity.ok(provisioningService.deletePeer(id));
    }

    /**
     * Enable or disable a peer.
     * PATCH /api/v1/peers/{id}/toggle
     */
    @PatchMapping("/peers/{id}/toggle")
    public ResponseEntity<ToggleResult> togglePeer(@PathVariable("id") String id) {
        return ResponseEntity.ok(provisioningService.togglePeer(id));
    }

    /**
     * Remove custody records whose router peer is gone.
     * POST /api/v1/peers/reconcile
     */
    @PostMapping("/peers/reconcile")
    public ResponseEntity<ReconcileResult> reconcile() {
        return ResponseEntity.ok(ReconcileResult.of(orphanReconciler.reconcileOrphans()));
    }

    /**
     * Server-side tunnel parameters.
     * GET /api/v1/server-info
     */
    @GetMapping("/server-info")
    public ResponseEntity<ServerInfo> getServerInfo() {
        return ResponseEntity.ok(provisioningService.getServerInfo());
    }

    // DTOs
    public record CreatePeerRequest(
        @NotBlank(message = "Peer name is required")
        @Size(max = PeerProvisioningService.MAX_NAME_LENGTH, message = "Peer name must be at most 255 characters")
        String name,
        String allowedIPs,
        Boolean usePresharedKey
    ) {}

    public record UpdatePeerRequest(
        @NotBlank(message = "Peer name is required")
        @Size(max = PeerProvisioningService.MAX_NAME_LENGTH, message = "Peer name must be at most 255 characters")
        String name,
        String allowedIPs,
        Boolean enabled,
        Boolean updatePresharedKey,
        Boolean regenerateCompletely
    ) {}

    // Exception handlers
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("PEER_001", message));
    }

    @ExceptionHandler(InvalidPeerRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidPeerRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("PEER_001", e.getMessage()));
    }

    @ExceptionHandler(PeerNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePeerNotFound(PeerNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("PEER_002", e.getMessage()));
    }

    @ExceptionHandler(ConfigUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleConfigUnavailable(ConfigUnavailableException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("PEER_003", e.getMessage(), Map.of(
                "requestedId", e.getRequestedId(),
                "availablePeerIds", e.getAvailableIds()
            )));
    }

    @ExceptionHandler(AddressPoolExhaustedException.class)
    public ResponseEntity<ErrorResponse> handlePoolExhausted(AddressPoolExhaustedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("PEER_004", e.getMessage()));
    }

    @ExceptionHandler(ServerNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleServerNotConfigured(ServerNotConfiguredException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("PEER_005", e.getMessage()));
    }

    @ExceptionHandler({KeyGenerationUnavailableException.class, InvalidGeneratedKeyException.class})
    public ResponseEntity<ErrorResponse> handleKeyGeneration(RuntimeException e) {
        log.error("Key generation failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("KEYS_001", e.getMessage()));
    }

    @ExceptionHandler(PeerIdResolutionFailedException.class)
    public ResponseEntity<ErrorResponse> handleIdResolution(PeerIdResolutionFailedException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("ROUTER_002", e.getMessage()));
    }

    @ExceptionHandler(SagaFailedException.class)
    public ResponseEntity<ErrorResponse> handleSagaFailed(SagaFailedException e) {
        log.error("Unrecovered failure in {} at step {}: {}", e.getSagaName(), e.getFailedStep(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("SAGA_001", e.getMessage(), Map.of(
                "saga", e.getSagaName(),
                "failedStep", e.getFailedStep(),
                "uncompensatedSteps", e.getCompensationFailures().stream()
                    .map(SagaFailedException.CompensationFailure::step)
                    .toList()
            )));
    }

    @ExceptionHandler(CustodyStoreException.class)
    public ResponseEntity<ErrorResponse> handleCustodyStore(CustodyStoreException e) {
        log.error("Custody store failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("CUSTODY_001", e.getMessage()));
    }

    @ExceptionHandler(UpstreamFailureException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamFailureException e) {
        log.error("Upstream failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("ROUTER_001", e.getMessage()));
    }
}
