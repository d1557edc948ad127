package io.healthsamurai.auditledger.chain;

import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.storage.AuditRecordStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline auditor that re-verifies everything in the record database, and checks it against the
 * published anchors when an {@link AnchorVerifier} is configured.
 */
public class ChainAuditor {

    private static final Logger log = LoggerFactory.getLogger(ChainAuditor.class);

    private final AuditRecordStore recordStore;
    private final HashChainEngine hashChainEngine;
    private final AnchorVerifier anchorVerifier;
    private final Clock clock;

    public ChainAuditor(AuditRecordStore recordStore, HashChainEngine hashChainEngine) {
        this(recordStore, hashChainEngine, null, Clock.systemUTC());
    }

    public ChainAuditor(AuditRecordStore recordStore, HashChainEngine hashChainEngine, Clock clock) {
        this(recordStore, hashChainEngine, null, clock);
    }

    /**
     * @param anchorVerifier Checks anchors during {@link #detectTampering()}, or null to skip them
     */
    public ChainAuditor(AuditRecordStore recordStore, HashChainEngine hashChainEngine,
                        AnchorVerifier anchorVerifier, Clock clock) {
        this.recordStore = recordStore;
        this.hashChainEngine = hashChainEngine;
        this.anchorVerifier = anchorVerifier;
        this.clock = clock;
    }

    /**
     * Verifies the full stored chain.
     *
     * @throws StorageException if the records cannot be read
     */
    public ChainVerificationResult verifyStoredChain() throws StorageException {
        return verify(recordStore.findAll(), "Audit chain");
    }

    /**
     * Verifies the stored records with {@code startSequence <= sequenceNumber <= endSequence}.
     * The genesis link is only checked when the range starts at sequence 1.
     *
     * @throws IllegalArgumentException if the range is empty or negative
     * @throws StorageException if the records cannot be read
     */
    public ChainVerificationResult verifyStoredChain(long startSequence, long endSequence) throws StorageException {
        if (startSequence < 1 || endSequence < startSequence) {
            throw new IllegalArgumentException("Invalid sequence range " + startSequence + "-" + endSequence);
        }
        ChainVerificationResult result = verify(recordStore.findBySequenceRange(startSequence, endSequence),
                "Audit chain range " + startSequence + "-" + endSequence);

        // Records missing at either end of the range are gaps too
        boolean empty = result.totalVerified() == 0;
        boolean headMissing = empty || result.startSequence() != startSequence;
        boolean tailMissing = !empty && result.endSequence() != endSequence;
        if (!headMissing && !tailMissing) {
            return result;
        }

        log.warn("Audit chain range {}-{} is incomplete: found {}-{}", startSequence, endSequence,
                result.startSequence(), result.endSequence());
        List<BrokenLink> brokenLinks = new ArrayList<>(result.brokenLinks());
        if (headMissing) {
            brokenLinks.add(0, new BrokenLink(startSequence, String.valueOf(startSequence),
                    empty ? "" : String.valueOf(result.startSequence()), BrokenLink.Reason.SEQUENCE_GAP));
        }
        if (tailMissing) {
            brokenLinks.add(new BrokenLink(endSequence, String.valueOf(endSequence),
                    String.valueOf(result.endSequence()), BrokenLink.Reason.SEQUENCE_GAP));
        }
        return new ChainVerificationResult(false, result.brokenAt() != null ? result.brokenAt() : 0,
                result.totalVerified(), result.startSequence(), result.endSequence(), brokenLinks);
    }

    /**
     * Recomputes the hash of a single stored record.
     *
     * @return true if the record exists and its stored hash matches its content
     * @throws StorageException if the records cannot be read
     */
    public boolean verifyRecord(String recordId) throws StorageException {
        Optional<ImmutableAuditRecord> record = recordStore.findById(recordId);
        if (record.isEmpty()) {
            log.warn("Audit record {} not found", recordId);
            return false;
        }
        boolean valid = hashChainEngine.computeHash(record.get()).equals(record.get().getRecordHash());
        if (!valid) {
            log.warn("Audit record {} (sequence {}) does not match its hash",
                    recordId, record.get().getSequenceNumber());
        }
        return valid;
    }

    /**
     * Checks the stored chain against the published anchors.
     *
     * @throws IllegalStateException if no anchor verifier is configured
     * @throws StorageException if records or anchors cannot be read
     */
    public AnchorVerificationResult verifyAnchors() throws StorageException {
        if (anchorVerifier == null) {
            throw new IllegalStateException("Anchor verification is not configured");
        }
        return anchorVerifier.verify(recordStore.findAll());
    }

    /**
     * Verifies the stored chain, and its anchors when configured, and describes any damage.
     *
     * @return A report, or null when the chain is intact
     * @throws StorageException if the records cannot be read
     */
    public TamperingReport detectTampering() throws StorageException {
        List<ImmutableAuditRecord> records = recordStore.findAll();
        ChainVerificationResult result = verify(records, "Audit chain");

        List<BrokenLink> brokenLinks = new ArrayList<>(result.brokenLinks());
        if (anchorVerifier != null) {
            brokenLinks.addAll(anchorVerifier.verify(records).failures());
        }
        if (brokenLinks.isEmpty()) {
            return null;
        }

        TamperingReport report = new TamperingReport(
                UUID.randomUUID().toString(),
                clock.instant(),
                result.startSequence() != null ? result.startSequence() : 0,
                result.endSequence() != null ? result.endSequence() : 0,
                brokenLinks,
                TamperingReport.Severity.forBrokenLinkCount(brokenLinks.size()));

        log.error("Possible audit tampering detected: report {} severity {} covering sequences {}-{}",
                report.reportId(), report.severity(), report.startSequence(), report.endSequence());
        return report;
    }

    private ChainVerificationResult verify(List<ImmutableAuditRecord> records, String scope) {
        long start = System.nanoTime();
        ChainVerificationResult result = hashChainEngine.verifyChain(records);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        if (result.ok()) {
            log.info("{} verified: {} records in {} ms", scope, result.totalVerified(), elapsedMs);
        } else {
            log.warn("{} verification found {} broken links in {} records, first at index {}",
                    scope, result.brokenLinks().size(), result.totalVerified(), result.brokenAt());
        }
        return result;
    }
}
