package com.peerwarden.api.reconcile;

import com.peerwarden.api.router.RouterUnavailableException;
import com.peerwarden.api.support.InMemoryKeyCustodyStore;
import com.peerwarden.api.support.InMemoryRouterClient;
import com.peerwarden.core.domain.KeyCustodyRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OrphanReconcilerTest {

    private static final String PRIVATE_KEY = "dwdtCnMYpX08FsFyUbJmRd9ML4frwJkqsXf7pR25LCo=";

    private InMemoryRouterClient router;
    private InMemoryKeyCustodyStore custody;
    private OrphanReconciler reconciler;

    @BeforeEach
    void setUp() {
        router = new InMemoryRouterClient();
        custody = new InMemoryKeyCustodyStore();
        reconciler = new OrphanReconciler(router, custody);
    }

    @Test
    void removesRecordsWhosePeerIsGone() {
        String liveId = router.seed("A", "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA=", "172.16.0.2/32").id();
        custody.save(KeyCustodyRecord.create(liveId, "A", PRIVATE_KEY, null, "172.16.0.2/32"));
        custody.save(KeyCustodyRecord.create("*2", "B", PRIVATE_KEY, null, "172.16.0.3/32"));

        int removed = reconciler.reconcileOrphans();

        assertThat(removed).isEqualTo(1);
        assertThat(custody.listAll()).extracting(KeyCustodyRecord::getRouterId).containsExactly(liveId);
    }

    @Test
    void nothingToDoWhenInSync() {
        String id = router.seed("A", "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA=", "172.16.0.2/32").id();
        custody.save(KeyCustodyRecord.create(id, "A", PRIVATE_KEY, null, "172.16.0.2/32"));

        assertThat(reconciler.reconcileOrphans()).isZero();
        assertThat(custody.listAll()).hasSize(1);
    }

    @Test
    void emptyRouterOrphansEveryRecord() {
        custody.save(KeyCustodyRecord.create("*1", "A", PRIVATE_KEY, null, "172.16.0.2/32"));
        custody.save(KeyCustodyRecord.create("*2", "B", PRIVATE_KEY, null, "172.16.0.3/32"));

        assertThat(reconciler.reconcileOrphans()).isEqualTo(2);
        assertThat(custody.listAll()).isEmpty();
    }

    @Test
    void routerFailureIsNotAnEmptyPeerSet() {
        custody.save(KeyCustodyRecord.create("*1", "A", PRIVATE_KEY, null, "172.16.0.2/32"));
        router.failListing(true);

        assertThatThrownBy(reconciler::reconcileOrphans).isInstanceOf(RouterUnavailableException.class);
        assertThat(custody.listAll()).hasSize(1);
    }

    @Test
    void resultMessageCarriesCount() {
        ReconcileResult result = ReconcileResult.of(3);

        assertThat(result.success()).isTrue();
        assertThat(result.cleanedCount()).isEqualTo(3);
        assertThat(result.message()).isEqualTo("Cleaned up 3 orphaned peer records");
    }
}
