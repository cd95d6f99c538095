package com.peerwarden.api.support;

import com.peerwarden.api.custody.CustodyStoreException;
import com.peerwarden.api.custody.KeyCustodyStore;
import com.peerwarden.core.domain.KeyCustodyRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Custody store held in memory, with write failure injection.
 */
public class InMemoryKeyCustodyStore implements KeyCustodyStore {

    private final Map<String, KeyCustodyRecord> records = new LinkedHashMap<>();
    private int failingSaves;
    private int failingPresharedKeyUpdates;

    /**
     * Makes the next {@code count} saves fail.
     */
    public synchronized void failNextSaves(int count) {
        this.failingSaves = count;
    }

    public synchronized void failNextPresharedKeyUpdates(int count) {
        this.failingPresharedKeyUpdates = count;
    }

    @Override
    public synchronized KeyCustodyRecord save(KeyCustodyRecord record) {
        if (failingSaves > 0) {
            failingSaves--;
            throw new CustodyStoreException("Failed to save peer keys: disk full", null);
        }
        KeyCustodyRecord existing = records.get(record.getRouterId());
        if (existing != null) {
            existing.replaceWith(record);
            return existing;
        }
        records.put(record.getRouterId(), record);
        return record;
    }

    @Override
    public synchronized Optional<KeyCustodyRecord> get(String routerId) {
        return Optional.ofNullable(records.get(routerId));
    }

    @Override
    public synchronized List<KeyCustodyRecord> listAll() {
        List<KeyCustodyRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(KeyCustodyRecord::getCreatedAt));
        return all;
    }

    @Override
    public synchronized boolean delete(String routerId) {
        return records.remove(routerId) != null;
    }

    @Override
    public synchronized boolean updatePresharedKey(String routerId, String presharedKey) {
        if (failingPresharedKeyUpdates > 0) {
            failingPresharedKeyUpdates--;
            throw new CustodyStoreException("Failed to update preshared key: connection lost", null);
        }
        KeyCustodyRecord record = records.get(routerId);
        if (record == null) {
            return false;
        }
        record.rotatePresharedKey(presharedKey);
        return true;
    }
}
