package com.peerwarden.api.reconcile;

import com.peerwarden.api.custody.KeyCustodyStore;
import com.peerwarden.api.router.RouterClient;
import com.peerwarden.api.router.RouterPeer;
import com.peerwarden.core.domain.KeyCustodyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes custody records whose router peer no longer exists.
 *
 * Only peers on the managed interface count as live. A router read failure
 * propagates; it is never taken to mean the router has no peers, which would
 * wipe every record.
 */
@Service
public class OrphanReconciler {

    private static final Logger log = LoggerFactory.getLogger(OrphanReconciler.class);

    private final RouterClient routerClient;
    private final KeyCustodyStore custodyStore;

    public OrphanReconciler(RouterClient routerClient, KeyCustodyStore custodyStore) {
        this.routerClient = routerClient;
        this.custodyStore = custodyStore;
    }

    /**
     * @return number of orphaned records removed
     */
    public int reconcileOrphans() {
        Set<String> liveIds = routerClient.listPeers().stream()
                .map(RouterPeer::id)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        List<KeyCustodyRecord> orphans = custodyStore.listAll().stream()
                .filter(record -> !liveIds.contains(record.getRouterId()))
                .toList();

        int removed = 0;
        for (KeyCustodyRecord orphan : orphans) {
            if (custodyStore.delete(orphan.getRouterId())) {
                log.info("Removed orphaned keys for peer: {} (ID: {})", orphan.getName(), orphan.getRouterId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} orphaned peer records", removed);
        }
        return removed;
    }
}
