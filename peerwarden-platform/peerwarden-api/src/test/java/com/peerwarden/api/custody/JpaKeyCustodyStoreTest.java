package com.peerwarden.api.custody;

import com.peerwarden.api.PeerwardenApiApplication;
import com.peerwarden.core.domain.KeyCustodyRecord;
import com.peerwarden.core.repository.KeyCustodyRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Custody store against the Flyway-migrated in-memory database.
 */
@SpringBootTest(classes = PeerwardenApiApplication.class)
@ActiveProfiles("test")
class JpaKeyCustodyStoreTest {

    private static final String PRIVATE_KEY = "dwdtCnMYpX08FsFyUbJmRd9ML4frwJkqsXf7pR25LCo=";
    private static final String OTHER_KEY = "hSDwCYkwp1R0i33ctD73Wg2/Og0mOBr066SpjqqbTmo=";
    private static final String PSK = "c2hhcmVkIHNlY3JldCBzaGFyZWQgc2VjcmV0IHNoYXI=";

    @Autowired
    private KeyCustodyStore store;

    @Autowired
    private KeyCustodyRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    void savesAndReadsBackByRouterId() {
        store.save(KeyCustodyRecord.create("*1", "laptop", PRIVATE_KEY, PSK, "172.16.0.2/32"));

        KeyCustodyRecord loaded = store.get("*1").orElseThrow();

        assertThat(loaded.getId()).isNotNull();
        assertThat(loaded.getName()).isEqualTo("laptop");
        assertThat(loaded.getPrivateKey()).isEqualTo(PRIVATE_KEY);
        assertThat(loaded.getPresharedKey()).isEqualTo(PSK);
        assertThat(loaded.getAllowedAddress()).isEqualTo("172.16.0.2/32");
        assertThat(store.get("*2")).isEmpty();
    }

    @Test
    void saveReplacesRecordForSameRouterPeer() {
        KeyCustodyRecord first = store.save(KeyCustodyRecord.create("*1", "laptop", PRIVATE_KEY, null, "172.16.0.2/32"));
        Instant createdAt = first.getCreatedAt();

        store.save(KeyCustodyRecord.create("*1", "laptop v2", OTHER_KEY, PSK, "172.16.0.5/32"));

        assertThat(store.listAll()).hasSize(1);
        KeyCustodyRecord loaded = store.get("*1").orElseThrow();
        assertThat(loaded.getName()).isEqualTo("laptop v2");
        assertThat(loaded.getPrivateKey()).isEqualTo(OTHER_KEY);
        assertThat(loaded.getAllowedAddress()).isEqualTo("172.16.0.5/32");
        assertThat(loaded.getCreatedAt()).isCloseTo(createdAt, within(1, ChronoUnit.MILLIS));
    }

    @Test
    void listsInCreationOrder() throws InterruptedException {
        store.save(KeyCustodyRecord.create("*A", "first", PRIVATE_KEY, null, "172.16.0.2/32"));
        Thread.sleep(5);
        store.save(KeyCustodyRecord.create("*B", "second", PRIVATE_KEY, null, "172.16.0.3/32"));

        assertThat(store.listAll()).extracting(KeyCustodyRecord::getRouterId).containsExactly("*A", "*B");
    }

    @Test
    void deleteReportsWhetherARecordWasRemoved() {
        store.save(KeyCustodyRecord.create("*1", "laptop", PRIVATE_KEY, null, "172.16.0.2/32"));

        assertThat(store.delete("*1")).isTrue();
        assertThat(store.delete("*1")).isFalse();
        assertThat(store.get("*1")).isEmpty();
    }

    @Test
    void recordWithoutAddressIsACustodyFailure() {
        assertThatThrownBy(() -> store.save(KeyCustodyRecord.create("*1", "legacy", PRIVATE_KEY, null, null)))
                .isInstanceOf(CustodyStoreException.class)
                .hasMessageStartingWith("Failed to save peer keys");
        assertThat(repository.findByRouterId("*1")).isEmpty();
    }

    @Test
    void nameWiderThanColumnIsACustodyFailure() {
        assertThatThrownBy(() -> store.save(
                KeyCustodyRecord.create("*1", "n".repeat(300), PRIVATE_KEY, null, "172.16.0.2/32")))
                .isInstanceOf(CustodyStoreException.class);
        assertThat(repository.findByRouterId("*1")).isEmpty();
    }

    @Test
    void presharedKeyRotationTouchesOnlyThatField() {
        store.save(KeyCustodyRecord.create("*1", "laptop", PRIVATE_KEY, null, "172.16.0.2/32"));

        assertThat(store.updatePresharedKey("*1", PSK)).isTrue();
        assertThat(store.updatePresharedKey("*9", PSK)).isFalse();

        KeyCustodyRecord loaded = store.get("*1").orElseThrow();
        assertThat(loaded.getPresharedKey()).isEqualTo(PSK);
        assertThat(loaded.getPrivateKey()).isEqualTo(PRIVATE_KEY);
        assertThat(loaded.hasPresharedKey()).isTrue();
    }
}
