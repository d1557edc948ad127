package io.healthsamurai.auditledger.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * An audit event after it has been placed in the ledger: sequenced, linked to its predecessor
 * and hashed. Apart from {@link #getStorageLocations()} nothing changes after construction.
 */
@Getter
@Builder(toBuilder = true)
public class ImmutableAuditRecord {

    /** Globally unique, never reused */
    private final String recordId;

    /** Position in the ledger, starting at 1 */
    private final long sequenceNumber;

    /** {@link #recordHash} of the record with {@code sequenceNumber - 1}, empty for the first record */
    private final String previousRecordHash;

    /** Lowercase hex SHA-256 over the canonical logical fields */
    private final String recordHash;

    /** Whether {@link #previousRecordHash} matched the ledger's last committed hash at commit time */
    private final boolean blockchainVerified;

    private final AuditEvent event;

    /** Ledger clock reading when the record was built */
    private final Instant createdAt;

    private final int retentionDays;

    /** Null when retention is indefinite */
    private final Instant autoDeleteAt;

    @Builder.Default
    private final StorageLocations storageLocations = new StorageLocations();
}
