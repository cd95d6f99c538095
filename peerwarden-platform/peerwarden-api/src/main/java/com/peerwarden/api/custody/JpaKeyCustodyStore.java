package com.peerwarden.api.custody;

import com.peerwarden.core.domain.KeyCustodyRecord;
import com.peerwarden.core.repository.KeyCustodyRecordRepository;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link KeyCustodyStore} on the {@code peer_keys} table.
 */
@Service
public class JpaKeyCustodyStore implements KeyCustodyStore {

    private static final Logger log = LoggerFactory.getLogger(JpaKeyCustodyStore.class);

    private final KeyCustodyRecordRepository repository;

    public JpaKeyCustodyStore(KeyCustodyRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public KeyCustodyRecord save(KeyCustodyRecord record) {
        return guarded("save peer keys", () -> {
            KeyCustodyRecord saved = repository.findByRouterId(record.getRouterId())
                    .map(existing -> {
                        existing.replaceWith(record);
                        return repository.saveAndFlush(existing);
                    })
                    .orElseGet(() -> repository.saveAndFlush(record));
            log.info("Saved keys for peer: {} (ID: {})", saved.getName(), saved.getRouterId());
            return saved;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KeyCustodyRecord> get(String routerId) {
        return guarded("get peer keys", () -> repository.findByRouterId(routerId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<KeyCustodyRecord> listAll() {
        return guarded("list peer keys", repository::findAllByOrderByCreatedAtAsc);
    }

    @Override
    @Transactional
    public boolean delete(String routerId) {
        return guarded("delete peer keys", () -> {
            if (!repository.existsByRouterId(routerId)) {
                log.debug("No keys stored for peer ID: {}", routerId);
                return false;
            }
            int removed = repository.deleteByRouterId(routerId);
            log.info("Deleted keys for peer ID: {} ({} record(s))", routerId, removed);
            return removed > 0;
        });
    }

    @Override
    @Transactional
    public boolean updatePresharedKey(String routerId, String presharedKey) {
        return guarded("update preshared key", () -> repository.findByRouterId(routerId)
                .map(record -> {
                    record.rotatePresharedKey(presharedKey);
                    repository.saveAndFlush(record);
                    log.info("Updated preshared key for peer ID: {}", routerId);
                    return true;
                })
                .orElseGet(() -> {
                    log.warn("No custody record to update preshared key for peer ID: {}", routerId);
                    return false;
                }));
    }

    private static <T> T guarded(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | ConstraintViolationException e) {
            throw new CustodyStoreException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
