package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.AuditAction;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The database path: the only copy that the ledger reads back, used for the restart baseline,
 * for offline verification and for reporting queries.
 *
 * <p>Only {@link #append}, {@link #findLatest} and {@link #findAll} are required; the read
 * helpers scan {@link #findAll} unless an implementation has a cheaper way.
 */
public interface AuditRecordStore {

    Comparator<ImmutableAuditRecord> NEWEST_FIRST = Comparator
            .comparing((ImmutableAuditRecord r) -> r.getEvent().getTimestamp(),
                    Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(ImmutableAuditRecord::getSequenceNumber)
            .reversed();

    /**
     * Appends one record. Either the whole record is stored or nothing is.
     *
     * @throws StorageException if the record was not stored
     */
    void append(ImmutableAuditRecord record) throws StorageException;

    /**
     * @return The record with the highest sequence number, if any
     */
    Optional<ImmutableAuditRecord> findLatest() throws StorageException;

    /**
     * @return All records in ascending sequence order
     */
    List<ImmutableAuditRecord> findAll() throws StorageException;

    default Optional<ImmutableAuditRecord> findById(String recordId) throws StorageException {
        if (recordId == null) {
            return Optional.empty();
        }
        return findAll().stream()
                .filter(record -> recordId.equals(record.getRecordId()))
                .findFirst();
    }

    /**
     * @return Records with {@code from <= sequenceNumber <= to}, in ascending sequence order
     */
    default List<ImmutableAuditRecord> findBySequenceRange(long from, long to) throws StorageException {
        return findAll().stream()
                .filter(record -> record.getSequenceNumber() >= from && record.getSequenceNumber() <= to)
                .toList();
    }

    /**
     * @return Matching records, newest event first, paged by the query's offset and limit
     */
    default List<ImmutableAuditRecord> query(AuditQuery query) throws StorageException {
        return findAll().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .skip(Math.max(0, query.getOffset()))
                .limit(Math.max(0, query.getLimit()))
                .toList();
    }

    default List<ImmutableAuditRecord> findByUser(String userId) throws StorageException {
        return query(AuditQuery.builder().userId(userId).build());
    }

    default List<ImmutableAuditRecord> findByResource(String resource, String resourceId) throws StorageException {
        return query(AuditQuery.builder().resource(resource).resourceId(resourceId).build());
    }

    default List<ImmutableAuditRecord> findByAction(AuditAction action) throws StorageException {
        return query(AuditQuery.builder().action(action).build());
    }
}
