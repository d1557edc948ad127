package io.healthsamurai.auditledger;

import io.healthsamurai.auditledger.builder.AuditRecordBuilder;
import io.healthsamurai.auditledger.chain.AnchorPublisher;
import io.healthsamurai.auditledger.chain.AnchorSigner;
import io.healthsamurai.auditledger.chain.AnchorVerifier;
import io.healthsamurai.auditledger.chain.ChainAuditor;
import io.healthsamurai.auditledger.chain.DigestPublisher;
import io.healthsamurai.auditledger.chain.HashChainEngine;
import io.healthsamurai.auditledger.client.SiemClient;
import io.healthsamurai.auditledger.config.LedgerConfig;
import io.healthsamurai.auditledger.retention.RetentionPolicyResolver;
import io.healthsamurai.auditledger.siem.SeverityClassifier;
import io.healthsamurai.auditledger.siem.SiemEventBuilder;
import io.healthsamurai.auditledger.storage.AuditRecordStore;
import io.healthsamurai.auditledger.storage.BlobStore;
import io.healthsamurai.auditledger.storage.FileSystemBlobStore;
import io.healthsamurai.auditledger.storage.JsonLinesAuditRecordStore;
import io.healthsamurai.auditledger.storage.SiemSink;
import io.healthsamurai.auditledger.storage.StorageFanOutCoordinator;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the process-wide {@link AuditLedger} from {@link LedgerConfig}.
 *
 * <p>The factory owns one worker pool per storage backend and hands out one shared ledger;
 * callers receive it by reference instead of reaching for a global.
 */
public class AuditLedgerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLedgerFactory.class);

    private static final int STORAGE_WORKER_THREADS = 4;

    private final HashChainEngine hashChainEngine = new HashChainEngine();

    private final List<ExecutorService> storageExecutors = new ArrayList<>();
    private AuditRecordStore recordStore;
    private BlobStore blobStore;
    private AuditLedger ledger;

    /**
     * Reads configuration and creates the backends and the shared ledger.
     */
    public synchronized void init() {
        if (ledger != null) {
            return;
        }
        log.info("Initializing AuditLedgerFactory");
        log.info("Record database: {}", LedgerConfig.getDbFile());
        log.info("Blob store root: {}", LedgerConfig.getBlobRoot());
        log.info("SIEM enabled: {}", LedgerConfig.isSiemEnabled());
        log.info("Storage quorum: {}", LedgerConfig.getQuorumPolicy());
        log.info("Storage timeout: {}s", LedgerConfig.getStorageTimeoutSeconds());

        this.recordStore = new JsonLinesAuditRecordStore(Path.of(LedgerConfig.getDbFile()));
        this.blobStore = new FileSystemBlobStore(Path.of(LedgerConfig.getBlobRoot()));
        SiemSink siemSink = LedgerConfig.isSiemEnabled() ? new SiemClient() : null;

        StorageFanOutCoordinator coordinator = new StorageFanOutCoordinator(
                recordStore,
                blobStore,
                siemSink,
                new SiemEventBuilder(new SeverityClassifier()),
                workerPool("database"),
                workerPool("blob"),
                workerPool("siem"),
                Duration.ofSeconds(LedgerConfig.getStorageTimeoutSeconds()));

        this.ledger = new AuditLedger(
                recordStore,
                new AuditRecordBuilder(hashChainEngine, new RetentionPolicyResolver()),
                coordinator,
                createAnchorPublisher(blobStore),
                LedgerConfig.getQuorumPolicy(),
                Clock.systemUTC(),
                LedgerConfig.isDebugEnabled());
    }

    /**
     * Returns the shared ledger, initializing the factory on first use. The ledger reads its
     * baseline lazily on the first {@link AuditLedger#logEvent} or an explicit
     * {@link AuditLedger#initialize()}.
     */
    public synchronized AuditLedger create() {
        if (ledger == null) {
            init();
        }
        return ledger;
    }

    /**
     * Creates an offline auditor over the same record database as the ledger. When an anchor key
     * is configured the auditor also checks the published anchors.
     */
    public synchronized ChainAuditor createAuditor() {
        if (ledger == null) {
            init();
        }
        AnchorVerifier anchorVerifier = null;
        String anchorKey = LedgerConfig.getAnchorKey();
        int interval = LedgerConfig.getAnchorInterval();
        if (anchorKey != null && interval > 0) {
            anchorVerifier = new AnchorVerifier(new AnchorSigner(anchorKey), blobStore, interval);
        }
        return new ChainAuditor(recordStore, hashChainEngine, anchorVerifier, Clock.systemUTC());
    }

    /**
     * Creates a daily digest publisher over the ledger's record database and blob store.
     *
     * @throws IllegalStateException if no anchor key is configured to sign digests with
     */
    public synchronized DigestPublisher createDigestPublisher() {
        if (ledger == null) {
            init();
        }
        String anchorKey = LedgerConfig.getAnchorKey();
        if (anchorKey == null) {
            throw new IllegalStateException("Daily digests need " + LedgerConfig.AUDIT_ANCHOR_KEY + " to be set");
        }
        return new DigestPublisher(recordStore, blobStore, new AnchorSigner(anchorKey), hashChainEngine,
                Clock.systemUTC());
    }

    /**
     * Closes the factory and releases resources.
     */
    @Override
    public synchronized void close() {
        log.info("Closing AuditLedgerFactory");
        for (ExecutorService executor : storageExecutors) {
            if (!executor.isShutdown()) {
                executor.shutdown();
            }
        }
    }

    private ExecutorService workerPool(String backend) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(STORAGE_WORKER_THREADS, r -> {
            Thread t = new Thread(r, "audit-" + backend + "-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        storageExecutors.add(executor);
        return executor;
    }

    private static AnchorPublisher createAnchorPublisher(BlobStore blobStore) {
        String anchorKey = LedgerConfig.getAnchorKey();
        int interval = LedgerConfig.getAnchorInterval();
        if (anchorKey == null || interval == 0) {
            log.info("Chain anchors disabled");
            return null;
        }
        log.info("Chain anchors every {} records", interval);
        return new AnchorPublisher(new AnchorSigner(anchorKey), blobStore, interval, Clock.systemUTC());
    }
}
