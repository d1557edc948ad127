package io.healthsamurai.auditledger;

import io.healthsamurai.auditledger.builder.AuditEventValidator;
import io.healthsamurai.auditledger.builder.AuditRecordBuilder;
import io.healthsamurai.auditledger.builder.RecordDocumentMapper;
import io.healthsamurai.auditledger.chain.AnchorPublisher;
import io.healthsamurai.auditledger.chain.HashChainEngine;
import io.healthsamurai.auditledger.exception.LedgerInitializationException;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.exception.StorageQuorumException;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.model.StorageLocations;
import io.healthsamurai.auditledger.storage.AuditRecordStore;
import io.healthsamurai.auditledger.storage.QuorumPolicy;
import io.healthsamurai.auditledger.storage.StorageFanOutCoordinator;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained audit ledger.
 *
 * <p>One instance owns the chain state of a process: the last assigned sequence number and the
 * hash of the last record placed in the chain. Callers share the instance and may call
 * {@link #logEvent(AuditEvent)} concurrently.
 *
 * <p>Sequence assignment, record construction, hashing and the advance of the chain state happen
 * under one lock, so every record links to the hash of the record numbered one below it. Storage
 * happens after the lock is released. The chain advances whether or not storage succeeds.
 */
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private final AuditRecordStore recordStore;
    private final AuditEventValidator validator;
    private final AuditRecordBuilder recordBuilder;
    private final StorageFanOutCoordinator storageCoordinator;
    private final AnchorPublisher anchorPublisher;
    private final QuorumPolicy quorumPolicy;
    private final Clock clock;
    private final boolean debugEnabled;

    private final Object initMonitor = new Object();
    private final ReentrantLock chainLock = new ReentrantLock();

    private volatile boolean initialized;

    // Guarded by chainLock
    private long sequenceNumber;
    private String lastRecordHash = HashChainEngine.GENESIS_HASH;

    /**
     * Creates a new ledger.
     *
     * @param recordStore Database path, read once for the baseline
     * @param recordBuilder Builds and hashes records
     * @param storageCoordinator Persists records to all backends
     * @param anchorPublisher Publishes signed anchors, or null when anchoring is off
     * @param quorumPolicy Minimum backend successes before {@link #logEvent} reports success
     * @param clock Source of creation timestamps
     * @param debugEnabled Log every committed record as pretty JSON
     */
    public AuditLedger(AuditRecordStore recordStore, AuditRecordBuilder recordBuilder,
                       StorageFanOutCoordinator storageCoordinator, AnchorPublisher anchorPublisher,
                       QuorumPolicy quorumPolicy, Clock clock, boolean debugEnabled) {
        this.recordStore = recordStore;
        this.validator = new AuditEventValidator();
        this.recordBuilder = recordBuilder;
        this.storageCoordinator = storageCoordinator;
        this.anchorPublisher = anchorPublisher;
        this.quorumPolicy = quorumPolicy;
        this.clock = clock;
        this.debugEnabled = debugEnabled;

        log.debug("AuditLedger created, quorum: {}, anchors: {}, debug: {}",
                quorumPolicy, anchorPublisher != null, debugEnabled);
    }

    /**
     * Adopts the latest durably stored record as the chain baseline, or sequence 0 with the
     * genesis hash when nothing is stored. Runs once; later calls return immediately. A failed
     * attempt leaves the ledger uninitialized so that a later call can try again.
     *
     * @throws LedgerInitializationException if the record store cannot be read
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        synchronized (initMonitor) {
            if (initialized) {
                return;
            }

            Optional<ImmutableAuditRecord> latest;
            try {
                latest = recordStore.findLatest();
            } catch (StorageException | RuntimeException e) {
                log.error("Failed to read audit chain baseline: {} - {}", e.getClass().getSimpleName(), e.getMessage());
                throw new LedgerInitializationException("Cannot read audit chain baseline from record store", e);
            }

            chainLock.lock();
            try {
                if (latest.isPresent()) {
                    sequenceNumber = latest.get().getSequenceNumber();
                    lastRecordHash = latest.get().getRecordHash();
                    log.info("Audit ledger resuming chain at sequence {}", sequenceNumber);
                } else {
                    sequenceNumber = 0;
                    lastRecordHash = HashChainEngine.GENESIS_HASH;
                    log.info("Audit ledger starting a new chain");
                }
            } finally {
                chainLock.unlock();
            }
            initialized = true;
        }
    }

    /**
     * Places an event in the chain and persists it to every backend.
     *
     * @param event The event to record
     * @return The record, with storage status set for every backend
     * @throws io.healthsamurai.auditledger.exception.InvalidAuditEventException if the event lacks
     *         identity or resource fields; no sequence number is used
     * @throws LedgerInitializationException if the baseline cannot be read
     * @throws StorageQuorumException if a quorum policy is configured and was not met
     */
    public ImmutableAuditRecord logEvent(AuditEvent event) {
        initialize();

        Instant now = clock.instant();
        AuditEvent validated = validator.validate(event, now);

        ImmutableAuditRecord record;
        chainLock.lock();
        try {
            long next = sequenceNumber + 1;
            // Linked to the head read under the same lock, so blockchainVerified is always true here
            record = recordBuilder.build(validated, next, lastRecordHash, lastRecordHash, now);
            sequenceNumber = next;
            lastRecordHash = record.getRecordHash();
        } finally {
            chainLock.unlock();
        }

        if (debugEnabled) {
            logRecord(record);
        }

        StorageLocations locations = storageCoordinator.persist(record);

        if (anchorPublisher != null) {
            anchorPublisher.publishIfDue(record);
        }

        log.info("Logged {} {} as record {} for user {} on {}/{}, stored: {}",
                validated.getEventType(), validated.getAction(), record.getSequenceNumber(),
                validated.getUserId(), validated.getResource(), validated.getResourceId(), locations);

        if (!quorumPolicy.isSatisfiedBy(locations)) {
            log.error("Record {} did not meet storage quorum {}: {}",
                    record.getSequenceNumber(), quorumPolicy, locations);
            throw new StorageQuorumException("Storage quorum " + quorumPolicy + " not met for record "
                    + record.getSequenceNumber() + ": " + locations, record);
        }

        return record;
    }

    /**
     * Places several events in the chain under one hold of the chain lock, so they receive
     * contiguous sequence numbers in list order, then persists each of them.
     *
     * <p>Every event is validated first; one invalid event rejects the whole batch and no sequence
     * number is used. Storage and the quorum check work per record as in {@link #logEvent}: the
     * whole batch is persisted before a quorum failure is reported.
     *
     * @param events The events to record, in order
     * @return The records, in sequence order
     * @throws io.healthsamurai.auditledger.exception.InvalidAuditEventException if any event is invalid
     * @throws LedgerInitializationException if the baseline cannot be read
     * @throws StorageQuorumException for the first record that missed a configured quorum
     */
    public List<ImmutableAuditRecord> logBatch(List<AuditEvent> events) {
        initialize();
        if (events == null || events.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<AuditEvent> validated = new ArrayList<>(events.size());
        for (AuditEvent event : events) {
            validated.add(validator.validate(event, now));
        }

        List<ImmutableAuditRecord> records = new ArrayList<>(validated.size());
        chainLock.lock();
        try {
            for (AuditEvent event : validated) {
                long next = sequenceNumber + 1;
                ImmutableAuditRecord record = recordBuilder.build(event, next, lastRecordHash, lastRecordHash, now);
                sequenceNumber = next;
                lastRecordHash = record.getRecordHash();
                records.add(record);
            }
        } finally {
            chainLock.unlock();
        }

        ImmutableAuditRecord firstShortfall = null;
        for (ImmutableAuditRecord record : records) {
            if (debugEnabled) {
                logRecord(record);
            }
            StorageLocations locations = storageCoordinator.persist(record);
            if (anchorPublisher != null) {
                anchorPublisher.publishIfDue(record);
            }
            if (firstShortfall == null && !quorumPolicy.isSatisfiedBy(locations)) {
                firstShortfall = record;
            }
        }

        log.info("Logged batch of {} records, sequences {}-{}", records.size(),
                records.get(0).getSequenceNumber(), records.get(records.size() - 1).getSequenceNumber());

        if (firstShortfall != null) {
            log.error("Record {} of a batch did not meet storage quorum {}: {}",
                    firstShortfall.getSequenceNumber(), quorumPolicy, firstShortfall.getStorageLocations());
            throw new StorageQuorumException("Storage quorum " + quorumPolicy + " not met for record "
                    + firstShortfall.getSequenceNumber() + ": " + firstShortfall.getStorageLocations(), firstShortfall);
        }
        return records;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return The last sequence number placed in the chain
     */
    public long getSequenceNumber() {
        chainLock.lock();
        try {
            return sequenceNumber;
        } finally {
            chainLock.unlock();
        }
    }

    /**
     * @return The hash of the last record placed in the chain, or the genesis hash
     */
    public String getLastRecordHash() {
        chainLock.lock();
        try {
            return lastRecordHash;
        } finally {
            chainLock.unlock();
        }
    }

    /**
     * Logs a committed record in debug mode.
     */
    private void logRecord(ImmutableAuditRecord record) {
        try {
            log.info("[DEBUG] Committed audit record:\n{}", JsonUtil.toPrettyJson(RecordDocumentMapper.toDocument(record)));
        } catch (Exception e) {
            log.warn("Failed to serialize audit record for debug logging: {}", e.getMessage());
        }
    }
}
