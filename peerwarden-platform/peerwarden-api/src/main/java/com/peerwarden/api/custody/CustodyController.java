package com.peerwarden.api.custody;

import com.peerwarden.api.common.ErrorResponse;
import com.peerwarden.core.domain.KeyCustodyRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the custody table for troubleshooting.
 * Never returns key material.
 */
@RestController
@RequestMapping("/api/v1/custody")
public class CustodyController {

    private final KeyCustodyStore custodyStore;

    public CustodyController(KeyCustodyStore custodyStore) {
        this.custodyStore = custodyStore;
    }

    /**
     * List custody metadata.
     * GET /api/v1/custody/records
     */
    @GetMapping("/records")
    public ResponseEntity<List<CustodyRecordSummary>> listRecords() {
        return ResponseEntity.ok(custodyStore.listAll().stream()
            .map(CustodyRecordSummary::of)
            .toList());
    }

    public record CustodyRecordSummary(
        String routerId,
        String name,
        String allowedAddress,
        Instant createdAt,
        Instant updatedAt,
        boolean hasPresharedKey
    ) {
        static CustodyRecordSummary of(KeyCustodyRecord record) {
            return new CustodyRecordSummary(
                record.getRouterId(),
                record.getName(),
                record.getAllowedAddress(),
                record.getCreatedAt(),
                record.getUpdatedAt(),
                record.hasPresharedKey()
            );
        }
    }

    @ExceptionHandler(CustodyStoreException.class)
    public ResponseEntity<ErrorResponse> handleCustodyStore(CustodyStoreException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("CUSTODY_001", e.getMessage()));
    }
}
