package com.peerwarden.core.repository;

import com.peerwarden.core.domain.KeyCustodyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for KeyCustodyRecord entities.
 */
@Repository
public interface KeyCustodyRecordRepository extends JpaRepository<KeyCustodyRecord, UUID> {

    /**
     * Find the custody record for a router peer.
     */
    Optional<KeyCustodyRecord> findByRouterId(String routerId);

    boolean existsByRouterId(String routerId);

    /**
     * All records ordered by creation time, oldest first.
     */
    List<KeyCustodyRecord> findAllByOrderByCreatedAtAsc();

    @Modifying
    @Query("DELETE FROM KeyCustodyRecord r WHERE r.routerId = :routerId")
    int deleteByRouterId(@Param("routerId") String routerId);
}
