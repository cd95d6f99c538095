package com.peerwarden.api.custody;

import com.peerwarden.core.domain.KeyCustodyRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable custody of peer private material, keyed by router peer id.
 * Implementations throw {@link CustodyStoreException} on storage failures.
 */
public interface KeyCustodyStore {

    /**
     * Inserts the record, or replaces the existing record for the same router peer.
     */
    KeyCustodyRecord save(KeyCustodyRecord record);

    Optional<KeyCustodyRecord> get(String routerId);

    List<KeyCustodyRecord> listAll();

    /**
     * @return whether a record was removed
     */
    boolean delete(String routerId);

    /**
     * @return whether a record was updated
     */
    boolean updatePresharedKey(String routerId, String presharedKey);
}
