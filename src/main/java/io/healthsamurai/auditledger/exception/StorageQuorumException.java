package io.healthsamurai.auditledger.exception;

import io.healthsamurai.auditledger.model.ImmutableAuditRecord;

/**
 * Thrown when a configured quorum policy was not met. The record has already been placed in the
 * chain; it is carried here so the caller can inspect or re-drive its storage.
 */
public class StorageQuorumException extends RuntimeException {

    private final transient ImmutableAuditRecord record;

    public StorageQuorumException(String message, ImmutableAuditRecord record) {
        super(message);
        this.record = record;
    }

    public ImmutableAuditRecord getRecord() {
        return record;
    }
}
