package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.builder.RecordDocumentMapper;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.model.StorageLocations;
import io.healthsamurai.auditledger.siem.SiemEventBuilder;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record to the database, the blob store and the SIEM at the same time.
 *
 * <p>The three writes are independent: a failure or timeout in one neither cancels nor rolls back
 * the others. Each backend runs on its own executor, so a slow backend only queues work behind
 * itself. {@link #persist(ImmutableAuditRecord)} waits for all three outcomes and records them in
 * the record's {@link StorageLocations}. No write is retried here.
 *
 * <p>The timeout bounds how long {@code persist} waits for a backend, not the write itself. A
 * write that misses the timeout is reported as failed and still runs to completion; a late
 * outcome is logged.
 */
public class StorageFanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StorageFanOutCoordinator.class);

    static final String RECORD_PREFIX = "audit-logs/";

    private final AuditRecordStore recordStore;
    private final BlobStore blobStore;
    private final SiemSink siemSink;
    private final SiemEventBuilder siemEventBuilder;
    private final ExecutorService databaseExecutor;
    private final ExecutorService blobExecutor;
    private final ExecutorService siemExecutor;
    private final Duration timeout;

    /**
     * @param siemSink SIEM endpoint, or null when SIEM forwarding is disabled
     * @param databaseExecutor Runs database writes; owned by the caller
     * @param blobExecutor Runs blob writes; owned by the caller
     * @param siemExecutor Runs SIEM sends that have no non-blocking transport; owned by the caller
     * @param timeout How long {@link #persist} waits for each backend
     */
    public StorageFanOutCoordinator(AuditRecordStore recordStore, BlobStore blobStore, SiemSink siemSink,
                                    SiemEventBuilder siemEventBuilder, ExecutorService databaseExecutor,
                                    ExecutorService blobExecutor, ExecutorService siemExecutor, Duration timeout) {
        this.recordStore = recordStore;
        this.blobStore = blobStore;
        this.siemSink = siemSink;
        this.siemEventBuilder = siemEventBuilder;
        this.databaseExecutor = databaseExecutor;
        this.blobExecutor = blobExecutor;
        this.siemExecutor = siemExecutor;
        this.timeout = timeout;
    }

    /**
     * Persists a record to all backends and waits for every outcome. Never throws for a backend
     * failure.
     *
     * @param record The record to store
     * @return The record's storage locations, now fully set
     */
    public StorageLocations persist(ImmutableAuditRecord record) {
        CompletableFuture<Boolean> database = track("database", record,
                () -> runOn(databaseExecutor, () -> recordStore.append(record)));

        CompletableFuture<Boolean> blob = track("blobStore", record,
                () -> runOn(blobExecutor, () -> blobStore.putIfAbsent(blobKey(record),
                        JsonUtil.toJson(RecordDocumentMapper.toDocument(record)).getBytes(StandardCharsets.UTF_8))));

        CompletableFuture<Boolean> siem;
        if (siemSink != null) {
            siem = track("siem", record,
                    () -> siemSink.sendAsync(siemEventBuilder.buildSiemEvent(record), siemExecutor));
        } else {
            log.debug("SIEM forwarding disabled, skipping record {}", record.getSequenceNumber());
            siem = CompletableFuture.completedFuture(false);
        }

        CompletableFuture.allOf(database, blob, siem).join();

        StorageLocations locations = record.getStorageLocations();
        locations.markDatabase(database.join());
        locations.markBlobStore(blob.join());
        locations.markSiem(siem.join());

        if (locations.successCount() < 3) {
            log.warn("Record {} stored partially: {}", record.getSequenceNumber(), locations);
        } else {
            log.debug("Record {} stored in all backends", record.getSequenceNumber());
        }
        return locations;
    }

    /**
     * Object key of a record: {@code audit-logs/<yyyy-MM-dd>/<recordId>.json}, dated by the
     * event timestamp in UTC.
     */
    public static String blobKey(ImmutableAuditRecord record) {
        String date = DateTimeFormatter.ISO_LOCAL_DATE
                .format(record.getEvent().getTimestamp().atZone(ZoneOffset.UTC));
        return RECORD_PREFIX + date + "/" + record.getRecordId() + ".json";
    }

    private static CompletableFuture<Void> runOn(ExecutorService executor, BackendWrite operation) {
        return CompletableFuture.runAsync(() -> {
            try {
                operation.run();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Starts a write and maps its outcome to a flag. The timeout applies to a separate outcome
     * future, so the write itself is never completed early and always runs once it was accepted.
     */
    private CompletableFuture<Boolean> track(String backend, ImmutableAuditRecord record,
                                             Supplier<CompletableFuture<?>> start) {
        CompletableFuture<?> attempt;
        try {
            attempt = start.get();
        } catch (RuntimeException e) {
            logFailure(backend, record, e);
            return CompletableFuture.completedFuture(false);
        }

        CompletableFuture<Boolean> outcome = new CompletableFuture<>();
        attempt.whenComplete((ignored, ex) -> {
            boolean inTime = ex == null ? outcome.complete(true) : outcome.completeExceptionally(ex);
            if (!inTime) {
                log.warn("Record {} {} in {} after the {} ms timeout",
                        record.getSequenceNumber(), ex == null ? "was stored" : "failed", backend, timeout.toMillis());
            }
        });

        return outcome
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    logFailure(backend, record, unwrap(ex));
                    return false;
                });
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    private void logFailure(String backend, ImmutableAuditRecord record, Throwable cause) {
        if (cause instanceof TimeoutException) {
            log.error("Storing record {} in {} timed out after {} ms",
                    record.getSequenceNumber(), backend, timeout.toMillis());
            return;
        }
        log.error("Failed to store record {} in {}: {} - {}",
                record.getSequenceNumber(), backend, cause.getClass().getSimpleName(), cause.getMessage());
        if (log.isDebugEnabled()) {
            log.debug("Full error:", cause);
        }
    }

    @FunctionalInterface
    private interface BackendWrite {
        void run() throws StorageException, IOException;
    }
}
